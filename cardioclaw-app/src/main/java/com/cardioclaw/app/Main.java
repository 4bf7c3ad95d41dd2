package com.cardioclaw.app;

import com.cardioclaw.app.cli.CardioclawCommand;

/**
 * Command-line entry point.
 */
public final class Main {

    private Main() {
    }

    public static void main(String[] args) {
        CardioclawCommand root = new CardioclawCommand();
        int code = CardioclawCommand.commandLine(root).execute(args);
        // The dashboard keeps the JVM alive through the web server's threads.
        if (!root.isServing()) {
            System.exit(code);
        }
    }
}
