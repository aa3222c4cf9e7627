package io.tasklink;

import io.tasklink.cli.TaskLinkCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        System.exit(TaskLinkCommand.commandLine().execute(args));
    }
}
