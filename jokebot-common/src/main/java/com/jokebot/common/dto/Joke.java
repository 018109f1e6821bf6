package com.jokebot.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 推送给订阅者的笑话内容。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Joke {

    private Long id;

    /** 分类: general / programming / knock-knock ... */
    private String type;

    private String setup;

    private String punchline;

    /**
     * 格式化为可直接发送的文本：铺垫与笑点之间空一行。
     */
    public String format() {
        return setup + "\n\n" + punchline;
    }
}
