package com.jokebot.scheduler.model;

/**
 * 任务执行器的状态：IDLE → POLLING → DISPATCHING → IDLE，关闭后为 STOPPED。
 */
public enum RunnerState {
    IDLE, POLLING, DISPATCHING, STOPPED
}
