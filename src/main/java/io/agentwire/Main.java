package io.agentwire;

import io.agentwire.cli.AgentWireCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = AgentWireCommand.commandLine().execute(args);
        System.exit(code);
    }
}
