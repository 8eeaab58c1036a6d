package io.tabsense;

import io.tabsense.cli.TabSenseCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TabSenseCommand()).execute(args);
        System.exit(code);
    }
}
