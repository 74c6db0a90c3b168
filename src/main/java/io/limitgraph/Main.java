package io.limitgraph;

import io.limitgraph.cli.LimitGraphCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = LimitGraphCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
