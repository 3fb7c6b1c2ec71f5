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

import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The context an Ensemble X command runs in: the layered configuration plus named variables (for
 * example the command line arguments).
 * <p>
 * The context is not supposed to be used in a multithreaded context.
 */
public class EnxContext extends CompositeConfiguration {

  private Map<String, Object> variables;

  /** Create a context that reads the default configuration layers. */
  public EnxContext() {
    super();
    addConfiguration(EnxProperties.loadProperties());
  }

  /**
   * A helper constructor used in main(String[]) method calls
   *
   * @param args are the command line arguments from a main()
   */
  public EnxContext(String[] args) {
    this();
    setVariable("args", args);
  }

  /**
   * @param name the name of the variable to lookup
   * @return the variable value, or null if it is not set.
   */
  public Object getVariable(String name) {
    if (variables == null) {
      return null;
    }
    return variables.get(name);
  }

  /**
   * Sets the value of the given variable
   *
   * @param name the name of the variable to set
   * @param value the new value for the given variable
   */
  public void setVariable(String name, Object value) {
    if (variables == null) {
      variables = new LinkedHashMap<>();
    }
    variables.put(name, value);
  }

  /**
   * Simple check for whether the context contains a particular variable or not.
   *
   * @param name the name of the variable to check for
   * @return true if the variable is set.
   */
  public boolean hasVariable(String name) {
    return variables != null && variables.containsKey(name);
  }
}
