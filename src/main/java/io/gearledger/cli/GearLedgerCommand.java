package io.gearledger.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.gearledger.client.ApiResult;
import io.gearledger.client.CatalogFile;
import io.gearledger.client.SseClient;
import io.gearledger.client.SyncApiClient;
import io.gearledger.client.SyncEventListener;
import io.gearledger.config.SyncConfig;
import io.gearledger.config.SyncSettings;
import io.gearledger.discovery.ServerBroadcaster;
import io.gearledger.discovery.ServerDiscovery;
import io.gearledger.model.ResultRecord;
import io.gearledger.server.SyncServer;
import io.gearledger.server.SyncServerListener;
import io.gearledger.storage.Database;
import io.gearledger.storage.ResultStore;
import io.gearledger.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "gearledger",
        mixinStandardHelpOptions = true,
        description = "Gear Ledger LAN sync server and client CLI",
        subcommands = {
                GearLedgerCommand.InitCommand.class,
                GearLedgerCommand.ServeCommand.class,
                GearLedgerCommand.DiscoverCommand.class,
                GearLedgerCommand.StatusCommand.class,
                GearLedgerCommand.VersionCommand.class,
                GearLedgerCommand.ResultsCommand.class,
                GearLedgerCommand.AddCommand.class,
                GearLedgerCommand.UpdateCommand.class,
                GearLedgerCommand.DeleteCommand.class,
                GearLedgerCommand.ClearCommand.class,
                GearLedgerCommand.ClientsCommand.class,
                GearLedgerCommand.ExportCommand.class,
                GearLedgerCommand.CatalogInfoCommand.class,
                GearLedgerCommand.CatalogUploadCommand.class,
                GearLedgerCommand.CatalogDownloadCommand.class,
                GearLedgerCommand.WatchCommand.class
        }
)
public final class GearLedgerCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory (default ~/.gearledger/data)")
    String root;

    @Option(names = {"--server"}, description = "Server base URL for client commands (default http://127.0.0.1:<http_port>)")
    String server;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | serve | discover | status | version | results | add | update | delete | clear | clients | export | catalog-info | catalog-upload | catalog-download | watch");
    }

    SyncConfig config() {
        return SyncConfig.fromRoot(root);
    }

    SyncSettings settings() {
        return SyncSettings.load(config());
    }

    ResultStore openStore(SyncSettings settings) {
        Database db = new Database(config(), settings.busyTimeoutMs());
        db.init();
        return new ResultStore(db);
    }

    SyncApiClient client() {
        SyncSettings settings = settings();
        String url = server == null || server.isBlank() ? "http://127.0.0.1:" + settings.httpPort() : server;
        return new SyncApiClient(url, settings);
    }

    static void print(Object value) {
        System.out.println(Jsons.toPrettyJson(value));
    }

    static int printResult(ApiResult result) {
        if (result.ok()) {
            print(result.body());
            return 0;
        }
        LinkedHashMap<String, Object> out = new LinkedHashMap<>();
        out.put("ok", false);
        out.put("status", result.status());
        out.put("error", result.error());
        print(out);
        return 1;
    }

    @Command(name = "init", description = "Initialize data directory and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Override
        public Integer call() {
            parent.openStore(parent.settings());
            System.out.println("Initialized Gear Ledger at: " + parent.config().rootDir());
            return 0;
        }
    }

    @Command(name = "serve", description = "Run the sync server and announce it on the LAN")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Option(names = {"--port"}, description = "HTTP port (overrides settings file)")
        Integer port;

        @Option(names = {"--name"}, description = "Server name announced to clients")
        String name;

        @Option(names = {"--no-broadcast"}, defaultValue = "false", description = "Do not announce on the discovery port")
        boolean noBroadcast;

        @Override
        public Integer call() throws Exception {
            SyncSettings settings = parent.settings();
            if (port != null) {
                settings = settings.withHttpPort(port);
            }
            if (name != null && !name.isBlank()) {
                settings = settings.withServerName(name.trim());
            }
            SyncServer syncServer = new SyncServer(parent.openStore(settings), settings);
            syncServer.addListener(new SyncServerListener() {
                @Override
                public void onClientCountChanged(int count) {
                    System.out.println("Connected clients: " + count);
                }
            });
            syncServer.start();
            ServerBroadcaster broadcaster = new ServerBroadcaster(syncServer.port(), settings.serverName(), settings);
            if (!noBroadcast) {
                broadcaster.start();
            }
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                broadcaster.stop();
                syncServer.stop();
            }, "gearledger-shutdown"));
            System.out.println("Gear Ledger server running at " + syncServer.serverUrl());
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "discover", description = "Listen for server announcements and print the live servers")
    static final class DiscoverCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Option(names = {"--seconds"}, defaultValue = "5", description = "How long to listen")
        int seconds;

        @Override
        public Integer call() throws Exception {
            ServerDiscovery discovery = new ServerDiscovery(
                    s -> System.out.println("Found " + s.name() + " at " + s.url()),
                    parent.settings()
            );
            discovery.start();
            try {
                Thread.sleep(Math.max(1, seconds) * 1000L);
                print(discovery.servers());
            } finally {
                discovery.stop();
            }
            return 0;
        }
    }

    @Command(name = "status", description = "Check server reachability, sync version and connected clients")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Override
        public Integer call() {
            SyncApiClient api = parent.client();
            boolean connected = api.checkConnection();
            LinkedHashMap<String, Object> out = new LinkedHashMap<>();
            out.put("server", api.serverUrl());
            out.put("connected", connected);
            if (connected) {
                out.put("version", api.getSyncVersion());
                out.put("connected_clients", api.getConnectedClientCount());
            }
            print(out);
            return connected ? 0 : 1;
        }
    }

    @Command(name = "version", description = "Print the server's sync version")
    static final class VersionCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Override
        public Integer call() {
            long version = parent.client().getSyncVersion();
            print(Map.of("version", version));
            return version < 0 ? 1 : 0;
        }
    }

    @Command(name = "results", description = "List results, optionally for one client")
    static final class ResultsCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Option(names = {"--client"}, description = "Only this client's results")
        String client;

        @Override
        public Integer call() {
            print(parent.client().getAllResults(client));
            return 0;
        }
    }

    @Command(name = "add", description = "Add a result or merge it into the existing row")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Option(names = {"--artikul"}, required = true, description = "Part code")
        String artikul;

        @Option(names = {"--client"}, required = true, description = "Client name")
        String client;

        @Option(names = {"--quantity"}, defaultValue = "1", description = "Quantity")
        int quantity;

        @Option(names = {"--weight"}, defaultValue = "0", description = "Weight")
        double weight;

        @Option(names = {"--brand"}, defaultValue = "", description = "Brand")
        String brand;

        @Option(names = {"--description"}, defaultValue = "", description = "Description")
        String description;

        @Option(names = {"--price"}, defaultValue = "0", description = "Unit sale price")
        double price;

        @Override
        public Integer call() {
            return printResult(parent.client().addOrUpdateResult(
                    new ResultStore.ResultWrite(artikul, client, quantity, weight, brand, description, price)
            ));
        }
    }

    @Command(name = "update", description = "Edit fields of one result by id")
    static final class UpdateCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Option(names = {"--id"}, required = true, description = "Result id")
        long id;

        @Option(names = {"--set"}, required = true, description = "field=value, repeatable")
        Map<String, String> fields;

        @Override
        public Integer call() {
            boolean ok = parent.client().updateResult(id, fields);
            print(Map.of("ok", ok));
            return ok ? 0 : 1;
        }
    }

    @Command(name = "delete", description = "Delete one result by id")
    static final class DeleteCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Option(names = {"--id"}, required = true, description = "Result id")
        long id;

        @Override
        public Integer call() {
            boolean ok = parent.client().deleteResult(id);
            print(Map.of("ok", ok));
            return ok ? 0 : 1;
        }
    }

    @Command(name = "clear", description = "Delete all results, or one client's")
    static final class ClearCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Option(names = {"--client"}, description = "Only this client's results")
        String client;

        @Override
        public Integer call() {
            print(Map.of("deleted", parent.client().clearAllResults(client)));
            return 0;
        }
    }

    @Command(name = "clients", description = "List distinct client names")
    static final class ClientsCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Override
        public Integer call() {
            print(parent.client().getClients());
            return 0;
        }
    }

    @Command(name = "export", description = "Export the local ledger grouped by client")
    static final class ExportCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Option(names = {"--out"}, description = "Output JSON path (stdout when omitted)")
        Path out;

        @Override
        public Integer call() throws Exception {
            Map<String, List<ResultRecord>> grouped = parent.openStore(parent.settings()).exportByClient();
            if (out == null) {
                print(grouped);
                return 0;
            }
            Path parentDir = out.toAbsolutePath().getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(out, Jsons.toPrettyJson(grouped));
            System.out.println("Exported " + grouped.size() + " client(s) to " + out);
            return 0;
        }
    }

    @Command(name = "catalog-info", description = "Show metadata of the uploaded catalog")
    static final class CatalogInfoCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Override
        public Integer call() {
            return printResult(parent.client().getCatalogInfo());
        }
    }

    @Command(name = "catalog-upload", description = "Upload a catalog file to the server")
    static final class CatalogUploadCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Option(names = {"--file"}, required = true, description = "Catalog file path")
        Path file;

        @Override
        public Integer call() throws Exception {
            byte[] bytes = Files.readAllBytes(file);
            return printResult(parent.client().uploadCatalog(file.getFileName().toString(), bytes));
        }
    }

    @Command(name = "catalog-download", description = "Download the current catalog")
    static final class CatalogDownloadCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Option(names = {"--out"}, description = "Output path (defaults to the catalog's filename)")
        Path out;

        @Override
        public Integer call() throws Exception {
            Optional<CatalogFile> catalog = parent.client().downloadCatalog();
            if (catalog.isEmpty()) {
                System.out.println("{\"error\":\"no catalog available\"}");
                return 1;
            }
            Path target = out == null ? Path.of(catalog.get().filename()).getFileName() : out;
            Files.write(target, catalog.get().bytes());
            System.out.println("Saved " + catalog.get().size() + " bytes to " + target.toAbsolutePath());
            return 0;
        }
    }

    @Command(name = "watch", description = "Print sync events pushed by the server")
    static final class WatchCommand implements Callable<Integer> {
        @ParentCommand
        GearLedgerCommand parent;

        @Option(names = {"--seconds"}, defaultValue = "0", description = "Stop after this many seconds (0 = run until killed)")
        int seconds;

        @Override
        public Integer call() throws Exception {
            SyncApiClient api = parent.client();
            SseClient sse = new SseClient(api.serverUrl(), new SyncEventListener() {
                @Override
                public void onEvent(JsonNode event) {
                    System.out.println(Jsons.toJson(event));
                }

                @Override
                public void onDisconnected() {
                    System.out.println("{\"type\":\"disconnected\"}");
                }
            }, parent.settings());
            sse.start();
            try {
                if (seconds > 0) {
                    Thread.sleep(seconds * 1000L);
                } else {
                    Thread.currentThread().join();
                }
            } finally {
                sse.stop();
            }
            return 0;
        }
    }
}
