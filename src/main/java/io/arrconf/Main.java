package io.arrconf;

import io.arrconf.cli.ArrconfCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ArrconfCommand()).execute(args);
        System.exit(code);
    }
}
