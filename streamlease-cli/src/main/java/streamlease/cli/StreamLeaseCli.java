package streamlease.cli;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.security.Security;
import java.util.function.Function;

/**
 * Entry point. Settings come from {@code application.conf}, system properties and the optional {@code --config}
 * file, layered over each module's {@code reference.conf}.
 */
@CommandLine.Command(
        name = "streamlease",
        mixinStandardHelpOptions = true,
        description = "Consume or produce sample records on a sharded stream",
        subcommands = {RunCommand.class, ProduceCommand.class}
)
public class StreamLeaseCli implements Runnable {
  // the JVM caches successful DNS lookups forever unless told otherwise
  private static final String DNS_CACHE_TTL_SECONDS = "60";

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(
          names = "--config",
          description = "HOCON config file, overriding application.conf",
          scope = CommandLine.ScopeType.INHERIT
  )
  Path configFile;

  private final Function<Config, Module> backendModule;

  public StreamLeaseCli() {
    this(AwsBackendModule::new);
  }

  StreamLeaseCli(Function<Config, Module> backendModule) {
    this.backendModule = backendModule;
  }

  public static void main(String... args) {
    Security.setProperty("networkaddress.cache.ttl", DNS_CACHE_TTL_SECONDS);
    System.exit(new CommandLine(new StreamLeaseCli()).execute(args));
  }

  @Override
  public void run() {
    throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
  }

  Config loadConfig() {
    ConfigFactory.invalidateCaches();
    Config defaults = ConfigFactory.load();
    if (configFile == null) return defaults;
    return ConfigFactory.parseFile(configFile.toFile()).withFallback(defaults).resolve();
  }

  Injector injector() {
    Config config = loadConfig();
    return Guice.createInjector(new StreamLeaseModule(config), backendModule.apply(config));
  }
}
