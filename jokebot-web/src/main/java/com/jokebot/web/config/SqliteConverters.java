package com.jokebot.web.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

/**
 * SQLite 没有原生的布尔与时间类型：布尔存 0/1，时间由驱动存为 epoch 毫秒。
 * 读取时需要把整数列转换回实体字段类型。
 */
public final class SqliteConverters {

    private SqliteConverters() {
    }

    public static List<Converter<?, ?>> readingConverters() {
        return List.of(NumberToBooleanConverter.INSTANCE, NumberToLocalDateTimeConverter.INSTANCE);
    }

    @ReadingConverter
    enum NumberToBooleanConverter implements Converter<Number, Boolean> {
        INSTANCE;

        @Override
        public Boolean convert(Number source) {
            return source.intValue() != 0;
        }
    }

    @ReadingConverter
    enum NumberToLocalDateTimeConverter implements Converter<Number, LocalDateTime> {
        INSTANCE;

        @Override
        public LocalDateTime convert(Number source) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(source.longValue()), ZoneId.systemDefault());
        }
    }
}
