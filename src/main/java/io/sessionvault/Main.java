package io.sessionvault;

import io.sessionvault.cli.SessionVaultCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SessionVaultCommand()).execute(args);
        System.exit(code);
    }
}
