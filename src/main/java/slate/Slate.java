package slate;

import slate.db.SlateDatabase;
import slate.utils.Log;

/**
 * Entry point: {@code slate [config-file] [--key value ...] [-]}.
 */
public class Slate {

    public static void printBanner(Config config) {
        Log.info("\n" +
                "   _____ __      __     \n" +
                "  / ___// /___ _/ /____ \n" +
                "  \\__ \\/ / __ `/ __/ _ \\\n" +
                " ___/ / / /_/ / /_/  __/\n" +
                "/____/_/\\__,_/\\__/\\___/ \n" +
                "                        \n" +
                " :: Slate ::        (v" + config.version + ") \n" +
                " :: Engine ::       Java " + System.getProperty("java.version") + " \n" +
                " :: PID ::          " + ProcessHandle.current().pid() + " \n");
    }

    public static void main(String[] args) throws Exception {
        Log.info("Slate is starting");

        Config config;
        try {
            config = Config.fromCommandLine(args, System.in);
            Log.setLevel(config.loglevel);
        } catch (IllegalArgumentException e) {
            Log.error("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return;
        }
        Log.info("Configuration loaded from " + config.getSource());

        printBanner(config);

        SlateServer server = new SlateServer(config, new SlateDatabase());
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("Shutting down...");
            server.stop();
        }));

        server.awaitTermination();
    }
}
