package hdlconnect.ui;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class HDLConnectCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("hdlconnect - resolve the connect statements of a design description", options);
    System.exit(-1);
  };

  static {
    options.addOption(Option.builder("d")
                          .longOpt("design")
                          .argName("design.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML-file describing the modules, when scopes and connect statements")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with the connect options; defaults are used if not set")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("out")
                          .argName("file")
                          .hasArg()
                          .required(false)
                          .desc("File to write the emitted commands to; printed to stdout if not set")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stderr", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stderr")));
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    String designFile = "";
    String configFile = null;
    String outFile = null;
    try {
      CommandLine line = parser.parse(options, args);

      if (line.hasOption("h")) {
        printHelpAndExit(options);
      }

      designFile = line.getOptionValue("d");
      configFile = line.getOptionValue("c");
      outFile = line.getOptionValue("o");

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    }

    System.exit(run(designFile, configFile, outFile) ? 0 : 1);
  }

  /**
   * Reads the design and configuration, resolves all connect statements and writes the commands.
   * @return true iff every connect statement was resolved
   */
  static boolean run(String designFile, String configFile, String outFile) {
    if (logger == null)
      logger = LogManager.getLogger();
    HDLConnectConfig cfg = new HDLConnectConfig();
    if (configFile != null) {
      try (InputStream readFile = new FileInputStream(configFile)) {
        cfg = HDLConnectConfig.load(readFile);
      } catch (FileNotFoundException e) {
        logger.error("Config file {} could not be opened", configFile);
        return false;
      } catch (IOException e) {
        logger.error("Config file {} could not be read: {}", configFile, e.getMessage());
        return false;
      }
    }

    Design design;
    try (InputStream readFile = new FileInputStream(designFile)) {
      design = new DesignReader().read(readFile);
    } catch (FileNotFoundException e) {
      logger.error("Design file {} could not be opened", designFile);
      return false;
    } catch (IOException e) {
      logger.error("Design file {} could not be read: {}", designFile, e.getMessage());
      return false;
    } catch (DesignFormatException e) {
      logger.error("Invalid design {}: {}", designFile, e.getMessage());
      return false;
    }

    HDLConnect.Result result = new HDLConnect(cfg).Resolve(design);
    String serialized = result.getCommands().serialize();
    if (outFile == null) {
      System.out.println(serialized);
    } else {
      try (PrintStream out = new PrintStream(outFile, StandardCharsets.UTF_8)) {
        out.println(serialized);
      } catch (IOException e) {
        logger.error("Output file {} could not be written: {}", outFile, e.getMessage());
        return false;
      }
    }
    return result.isSuccess();
  }
}
