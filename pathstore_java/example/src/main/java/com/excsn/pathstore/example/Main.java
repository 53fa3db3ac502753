package com.excsn.pathstore.example;

import com.excsn.pathstore.core.PathFileValueProvider;
import com.excsn.pathstore.core.PathStoreBuilder;
import com.excsn.pathstore.core.PathStoreUtils;
import com.excsn.pathstore.core.telemetry.Slf4jLogger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.stream.Collectors;

public class Main {
  public static void main(String[] args) throws Exception {

    var logger = Slf4jLogger.create(Main.class);

    var configDir = Paths.get("src", "main", "resources", "config").toAbsolutePath();
    var configFilePaths = PathStoreUtils.defaultConfigFilePaths(configDir.toString(), "development");
    System.out.println("Config file paths: " + configFilePaths.stream().map(Path::toAbsolutePath).map(Path::toString).collect(Collectors.joining(", ")));

    // Work on a copy so saving does not touch the bundled file
    var workDir = Files.createTempDirectory("pathstore-example");
    var hostsFile = workDir.resolve("hosts.yaml");
    Files.copy(Paths.get("src", "main", "resources", "files", "hosts.yaml"), hostsFile);

    var hostsProvider = PathFileValueProvider.createDefault("hosts", "/files/etc/hosts", hostsFile, logger);

    var store = PathStoreBuilder.builder()
      .setConfigFilePaths(configFilePaths)
      .addProvider(hostsProvider)
      .build();

    store.init();

    System.out.println("Output of path '/system/config/save/mode': " + store.get("/system/config/save/mode"));
    System.out.println("Hosts: " + store.ls("/files/etc/hosts"));

    store.set("/files/etc/hosts/3/ipaddr", "192.168.0.10");
    store.set("/files/etc/hosts/3/canonical", "backup");
    store.insert("/files/etc/hosts/0", "/files/etc/hosts/1");
    store.set("/files/etc/hosts/0/ipaddr", "10.0.0.1");
    store.set("/files/etc/hosts/0/canonical", "gateway");

    var matches = new ArrayList<String>();
    var total = store.match("/files/etc/hosts/*/canonical", matches, 2);
    System.out.println("Matched " + total + " canonical names, first two: " + matches);

    var removed = store.rm("/files/etc/hosts/2");
    System.out.println("Removed " + removed + " entries");

    store.print(System.out, "/files");
    store.save();

    System.out.println("Saved hosts to " + hostsFile + ":");
    System.out.println(Files.readString(hostsFile));

    System.out.println("Example program ran successfully");
  }
}
