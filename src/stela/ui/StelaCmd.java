package stela.ui;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Locale;
import java.util.stream.Collectors;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import stela.backend.Statement;
import stela.backend.VarException;
import stela.backend.sv.SVFunction;
import stela.backend.sv.SVGenerator;
import stela.backend.sv.SVStatement;
import stela.backend.sv.SVVariable;
import stela.elab.ElaboratedBlock;
import stela.elab.ElaboratedFunction;
import stela.elab.ElaborationException;
import stela.elab.Elaborator;

public class StelaCmd {
  // logging
  protected static Logger logger = LogManager.getLogger();

  // options for cmdline parser
  static Options options = new Options();
  static {
    options.addOption(Option.builder("b")
                          .longOpt("block")
                          .argName("block.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML-file with the parsed block definition and its compile-time environment")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with elaboration options (debug, capture_locals, require_decoration)")
                          .build());
    options.addOption(Option.builder("f").longOpt("function").required(false).desc("Elaborate as function block").build());
    options.addOption(Option.builder("d").longOpt("debug").required(false).desc("Attach source lines and loop bindings").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
  }

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(Options options) {
    helper.printHelp("stelacmd - elaborate a hardware statement block into SystemVerilog", options);
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stderr writing, stdout carries the generated code
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stderr", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stderr")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    System.exit(run(args, System.out));
  }

  /**
   * Parses the arguments and elaborates the block.
   * @param out receives the generated code
   * @return the exit code, 0 on success
   */
  public static int run(String[] args, PrintStream out) {
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    String blockFileName;
    String configFileName;
    boolean asFunction;
    boolean debug;
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelp(options);
        return 0;
      }
      blockFileName = line.getOptionValue("b");
      configFileName = line.getOptionValue("c");
      asFunction = line.hasOption("f");
      debug = line.hasOption("d");

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
      printHelp(options);
      return 1;
    }

    //////////   read configuration and block   //////////
    StelaConfig cfg = new StelaConfig();
    if (configFileName != null) {
      try (InputStream configStream = new FileInputStream(configFileName)) {
        cfg = StelaConfig.load(configStream);
      } catch (IOException e) {
        logger.error("Config yaml file {} could not be read: {}", configFileName, e.getMessage());
        return 1;
      }
    }
    if (debug)
      cfg.debug = true;
    logger.debug("Using {}", cfg);

    SVGenerator generator = new SVGenerator("top");
    generator.setDebug(cfg.debug);
    YamlBlockReader.BlockDescription block;
    try (InputStream blockStream = new FileInputStream(blockFileName)) {
      block = new YamlBlockReader(generator).read(blockStream);
    } catch (IOException e) {
      logger.error("Block yaml file {} could not be read: {}", blockFileName, e.getMessage());
      return 1;
    } catch (IllegalArgumentException | VarException e) {
      logger.error("Invalid block description {}: {}", blockFileName, e.getMessage());
      return 1;
    }

    //////////   elaborate   //////////
    Elaborator elaborator = new Elaborator(generator, cfg);
    try {
      if (asFunction) {
        ElaboratedFunction function = elaborator.elaborateFunction(block.function(), block.args(), block.env(), block.source());
        out.print(renderFunction(function));
      } else {
        ElaboratedBlock result = elaborator.elaborateBlock(block.function(), block.env(), block.source());
        out.print(renderBlock(result));
      }
    } catch (ElaborationException | VarException e) {
      logger.error(e.getMessage());
      return 1;
    }
    return 0;
  }

  /** Renders an elaborated block as a SystemVerilog procedural block. */
  public static String renderBlock(ElaboratedBlock block) {
    StringBuilder text = new StringBuilder();
    switch (block.blockType()) {
    case Sequential:
      text.append("always_ff @(")
          .append(block.sensitivity()
                      .stream()
                      .map(entry -> entry.edge().name().toLowerCase(Locale.ROOT) + " " + entry.signal())
                      .collect(Collectors.joining(", ")))
          .append(")");
      break;
    case Initial:
      text.append("initial");
      break;
    default:
      text.append("always_comb");
      break;
    }
    text.append(" begin\n");
    for (Statement stmt : block.statements())
      ((SVStatement)stmt).render(text, 1);
    text.append("end\n");
    return text.toString();
  }

  /** Renders an elaborated function block as a SystemVerilog function. */
  public static String renderFunction(ElaboratedFunction function) {
    StringBuilder text = new StringBuilder();
    SVFunction svFunction = (SVFunction)function.function();
    text.append("function ").append(svFunction.getName()).append("(");
    text.append(svFunction.getInputs().stream().map(StelaCmd::declareInput).collect(Collectors.joining(", ")));
    text.append(");\n");
    for (Statement stmt : function.statements())
      ((SVStatement)stmt).render(text, 1);
    text.append("endfunction\n");
    return text.toString();
  }

  private static String declareInput(SVVariable input) {
    String type = "input logic" + (input.isSigned() ? " signed" : "");
    if (input.getWidth() > 1)
      type += " [" + (input.getWidth() - 1) + ":0]";
    return type + " " + input.getName();
  }
}
