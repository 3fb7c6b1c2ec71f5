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

package enx.utilities;

import java.awt.GraphicsEnvironment;
import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

import static picocli.CommandLine.usage;

/**
 * Base Ensemble X Command class.
 *
 * @author Ensemble X Developers
 */
public abstract class EnxCommand {

  /**
   * The logger for this class.
   */
  public static final Logger logger = Logger.getLogger(EnxCommand.class.getName());

  /**
   * In a headless environment, color will be ON for command line help.
   */
  public final Ansi color;

  /**
   * The array of args passed into the Command.
   */
  public String[] args;

  /**
   * Parse Result.
   */
  public ParseResult parseResult = null;

  /**
   * -V or --version Prints the version and exits.
   */
  @Option(
      names = {"-V", "--version"},
      versionHelp = true,
      defaultValue = "false",
      description = "Print the Ensemble X version and exit.")
  public boolean version;

  /**
   * -h or --help Prints a help message.
   */
  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      defaultValue = "false",
      description = "Print command help and exit.")
  public boolean help;

  /**
   * The context that provides the configuration and variables to this Command.
   */
  public EnxContext context;

  /**
   * Default constructor for a Command.
   */
  public EnxCommand() {
    this(new EnxContext());
  }

  /**
   * Create a Command using the supplied command line arguments.
   *
   * @param args The command line arguments.
   */
  public EnxCommand(String[] args) {
    this(new EnxContext(args));
  }

  /**
   * Create a Command with the supplied context.
   *
   * @param context the context that provides variables to this Command.
   */
  public EnxCommand(EnxContext context) {
    this.context = context;
    if (GraphicsEnvironment.isHeadless()) {
      color = Ansi.ON;
    } else {
      color = Ansi.OFF;
    }
  }

  /**
   * Default help information.
   *
   * @return String describing how to use this command.
   */
  public String helpString() {
    StringOutputStream sos = new StringOutputStream(new ByteArrayOutputStream());
    usage(this, sos, color);
    return " " + sos;
  }

  /**
   * Initialize this Command based on the specified command line arguments.
   *
   * @return boolean Returns true if the command should continue and false to exit.
   */
  public boolean init() {
    // The args variable could either be a list or an array of String arguments.
    Object arguments = context.getVariable("args");

    if (arguments instanceof List<?> list) {
      int numArgs = list.size();
      args = new String[numArgs];
      for (int i = 0; i < numArgs; i++) {
        args[i] = (String) list.get(i);
      }
    } else if (arguments instanceof String[]) {
      args = (String[]) arguments;
    } else if (arguments instanceof String) {
      args = new String[]{(String) arguments};
    } else {
      args = new String[0];
    }

    CommandLine commandLine = new CommandLine(this);
    try {
      parseResult = commandLine.parseArgs(args);
    } catch (CommandLine.UnmatchedArgumentException uae) {
      logger.warning(
          " The usual source of this exception is when long-form arguments (such as --occ) are only preceded by one dash.");
      throw uae;
    }

    if (help) {
      logger.info(helpString());
      return false;
    }

    return !version;
  }

  /**
   * Execute this Command.
   *
   * @return The current EnxCommand.
   */
  public EnxCommand run() {
    logger.info(helpString());
    return this;
  }
}
