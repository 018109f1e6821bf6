package com.jokebot.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * 订阅者表，一个 Telegram 会话一行。
 */
@Table("t_subscriber")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriberEntity {

    @Id
    private Long id;

    /** Telegram chat id，同时作为调度任务的 key */
    private String chatId;

    @Builder.Default
    private Boolean enabled = true;

    /** 推送间隔（分钟） */
    @Builder.Default
    private Integer frequency = 1;

    private LocalDateTime lastSentAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
