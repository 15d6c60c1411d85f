package io.gearledger;

import io.gearledger.cli.GearLedgerCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new GearLedgerCommand()).execute(args);
        System.exit(code);
    }
}
