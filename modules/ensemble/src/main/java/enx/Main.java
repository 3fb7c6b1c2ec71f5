//******************************************************************************
//
// Title:       Ensemble X.
// Description: Ensemble X - Structural Ensemble Assembly and Curation.
// Copyright:   Copyright (c) Ensemble X Developers 2025.
//
// This file is part of Ensemble X.
//
// Ensemble X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Ensemble X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Ensemble X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
//******************************************************************************

package enx;

import static java.lang.String.format;

import enx.ensemble.commands.AlignEnsemble;
import enx.ensemble.commands.BuildEnsemble;
import enx.ensemble.commands.Occupancy;
import enx.ensemble.commands.RefineEnsemble;
import enx.ensemble.commands.TrimEnsemble;
import enx.utilities.EnxCommand;
import enx.utilities.EnxContext;
import enx.utilities.LogFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Main is the entry point for the Ensemble X command line interface.
 *
 * <br>
 * Usage:
 * <br>
 * enx [-Dkey=value ...] &lt;command&gt; [command options]
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public final class Main {

  private static final Logger logger = Logger.getLogger(Main.class.getName());

  /**
   * Commands keyed by their upper case name.
   */
  private static final Map<String, Function<EnxContext, EnxCommand>> commands = new TreeMap<>();

  static {
    commands.put("ALIGNENSEMBLE", AlignEnsemble::new);
    commands.put("BUILDENSEMBLE", BuildEnsemble::new);
    commands.put("OCCUPANCY", Occupancy::new);
    commands.put("REFINEENSEMBLE", RefineEnsemble::new);
    commands.put("TRIMENSEMBLE", TrimEnsemble::new);
  }

  private Main() {
  }

  /**
   * Run a command.
   *
   * @param args command line arguments.
   */
  public static void main(String[] args) {
    args = processProperties(args);
    startLogging();

    if (args.length == 0) {
      commandLineInterfaceHelp();
      return;
    }

    try {
      EnxCommand command = createCommand(args[0],
          Arrays.asList(args).subList(1, args.length));
      if (command == null) {
        logger.warning(format(" Unknown command %s.", args[0]));
        commandLineInterfaceHelp();
        System.exit(1);
      }
      command.run();
    } catch (Throwable t) {
      int statusCode = 1;
      logger.log(Level.SEVERE, " Uncaught exception: exiting with status code " + statusCode, t);
      System.exit(statusCode);
    }
  }

  /**
   * Create the command with the given name.
   *
   * @param name the command name (case insensitive).
   * @param argList the arguments for the command.
   * @return the command, or null if the name is unknown.
   */
  public static EnxCommand createCommand(String name, List<String> argList) {
    Function<EnxContext, EnxCommand> factory = commands.get(name.toUpperCase(Locale.ROOT));
    if (factory == null) {
      return null;
    }
    EnxContext context = new EnxContext();
    context.setVariable("args", new ArrayList<>(argList));
    return factory.apply(context);
  }

  private static void commandLineInterfaceHelp() {
    StringBuilder sb = new StringBuilder("\n Usage: enx <command> [options]\n\n Commands:\n");
    for (String name : commands.keySet()) {
      EnxCommand command = commands.get(name).apply(new EnxContext());
      sb.append(format("  %s\n", command.getClass().getSimpleName()));
    }
    sb.append("\n For help on a specific command use:  enx <command> -h\n");
    logger.info(sb.toString());
  }

  /**
   * Set System properties given on the command line as "-Dkey=value".
   *
   * @param args the command line arguments.
   * @return the remaining arguments.
   */
  private static String[] processProperties(String[] args) {
    List<String> newArgs = new ArrayList<>();
    for (String arg : args) {
      arg = arg.trim();
      if (arg.startsWith("-D")) {
        // Remove -D from the front of String.
        arg = arg.substring(2);
        // Split at the first equals if it exists.
        if (arg.contains("=")) {
          int equalsPosition = arg.indexOf("=");
          String key = arg.substring(0, equalsPosition);
          String value = arg.substring(equalsPosition + 1);
          System.setProperty(key, value);
        } else if (arg.length() > 0) {
          System.setProperty(arg, "");
        }
      } else {
        newArgs.add(arg);
      }
    }
    return newArgs.toArray(new String[0]);
  }

  /**
   * Replace the default console handler with one using the {@link LogFormatter}.
   */
  private static void startLogging() {
    // Remove all log handlers from the default logger.
    Logger defaultLogger = LogManager.getLogManager().getLogger("");
    for (Handler h : defaultLogger.getHandlers()) {
      defaultLogger.removeHandler(h);
    }

    // Retrieve the log level from the enx.log system property.
    String logLevel = System.getProperty("enx.log", "info");
    Level level;
    try {
      level = Level.parse(logLevel.toUpperCase());
    } catch (Exception e) {
      level = Level.INFO;
    }

    boolean debug = Boolean.parseBoolean(System.getProperty("enx.log.debug", "false"));
    ConsoleHandler handler = new ConsoleHandler();
    handler.setFormatter(new LogFormatter(debug));
    handler.setLevel(level);
    defaultLogger.addHandler(handler);
    defaultLogger.setLevel(Level.WARNING);

    Logger enxLogger = Logger.getLogger("enx");
    enxLogger.setLevel(level);
  }
}
