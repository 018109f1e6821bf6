package com.jokebot.web.bot;

/**
 * 发给 Telegram 用户的回复文案。
 */
final class BotReplies {

    private BotReplies() {
    }

    private static final String COMMAND_LIST = "/start - Start the bot\n"
            + "/enable - Resume joke delivery\n"
            + "/disable - Pause joke delivery\n"
            + "/frequency <n> - Set frequency (1-1440 minutes)\n"
            + "/status - Check your settings\n"
            + "/test - Get a joke NOW (for testing)\n"
            + "/jobstatus - Check job queue status (debug)\n";

    private static final String CASE_HINT = "💡 Commands work with or without / and are case-insensitive.\n"
            + "Example: 'ENABLE', 'enable', '/enable' all work the same.";

    static final String WELCOME = "Welcome to Joke Bot! 🎉\n\n"
            + "I'll send you jokes at regular intervals.\n\n"
            + "Use /help to see available commands.";

    static final String HELP = "📋 Available Commands:\n\n" + COMMAND_LIST
            + "/help - Show this message\n\n" + CASE_HINT;

    static final String UNRECOGNIZED = "🤔 I didn't understand that message.\n\n📋 Available Commands:\n\n"
            + COMMAND_LIST + "/help - Show all commands\n\n" + CASE_HINT
            + "\n\nType /help for more information.";

    static final String USER_NOT_FOUND = "❌ User not found. Use /start to begin.";
    static final String DISABLED = "⏸️ Joke delivery paused. Use /enable to resume.";
    static final String ALREADY_DISABLED = "⏸️ Jokes are already disabled! Use /enable to resume joke delivery.";
    static final String FREQUENCY_FORMAT = "❌ Invalid format. Use: /frequency <minutes>\n\nExample: /frequency 5";
    static final String TESTING = "🧪 Testing joke delivery... please wait...";
    static final String TEST_FAILED = "❌ Test failed. Please try again later.";
    static final String TEST_NOT_ENABLED = "⏸️ Jokes are disabled. Use /enable first.";
    static final String TEST_BUSY = "⏳ A joke is already on its way to you.";
    static final String ERROR = "Sorry, there was an error. Please try again.";

    static String unknownCommand(String command) {
        return "❌ Unknown command: /" + command + "\n\n📋 Available Commands:\n\n" + COMMAND_LIST
                + "/help - Show all commands\n\n" + CASE_HINT;
    }

    static String tooFast(int retryAfterSeconds) {
        return "⚠️ You're sending commands too quickly. Please wait " + retryAfterSeconds
                + " seconds before trying again.";
    }

    static String enabled(int frequency) {
        return "✅ Joke delivery enabled! You will now receive jokes every " + frequency + " minute(s).";
    }

    static String alreadyEnabled(int frequency) {
        return "✅ Jokes are already enabled! You are receiving jokes every " + frequency + " minute(s).";
    }

    static String frequencyUpdated(int frequency) {
        return "✅ Frequency updated! You will receive jokes every " + frequency + " minute(s).";
    }

    static String status(boolean enabled, int frequency, String lastSent) {
        return "📊 Your Status:\n\nJokes: " + (enabled ? "✅ Enabled" : "⏸️ Disabled")
                + "\nFrequency: Every " + frequency + " minute(s)"
                + "\nLast Joke: " + lastSent;
    }

    static String jobStatus(boolean scheduled, int interval, String nextRun, int failCount, long activeJobs) {
        if (!scheduled) {
            return "📊 Job Status:\n\nScheduled: No\nActive jobs: " + activeJobs;
        }
        return "📊 Job Status:\n\nScheduled: Yes"
                + "\nEvery: " + interval + " minute(s)"
                + "\nNext run: " + nextRun
                + "\nFailures since last success: " + failCount
                + "\nActive jobs: " + activeJobs;
    }
}
