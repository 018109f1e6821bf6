package com.jokebot.common.exception;

/**
 * 推送间隔越界（合法范围 1~1440 分钟），同步拒绝，不会落库。
 */
public class InvalidIntervalException extends JokeBotException {

    public static final int MIN_MINUTES = 1;
    public static final int MAX_MINUTES = 1440;

    private final int requested;

    public InvalidIntervalException(int requested) {
        super("INVALID_INTERVAL", "Frequency must be between " + MIN_MINUTES + " and "
                + MAX_MINUTES + " minutes.");
        this.requested = requested;
    }

    public int getRequested() {
        return requested;
    }

    /**
     * 校验间隔，越界时抛出本异常。
     */
    public static int check(int minutes) {
        if (minutes < MIN_MINUTES || minutes > MAX_MINUTES) {
            throw new InvalidIntervalException(minutes);
        }
        return minutes;
    }
}
