package io.enforcerlink;

import io.enforcerlink.cli.EnforcerLinkCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new EnforcerLinkCommand()).execute(args);
        System.exit(code);
    }
}
