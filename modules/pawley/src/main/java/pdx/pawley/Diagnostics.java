// ******************************************************************************
//
// Title:       Powder Diffraction X.
// Description: Powder Diffraction X - Pawley Refinement of Powder Diffraction Data.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2021.
//
// This file is part of Powder Diffraction X.
//
// Powder Diffraction X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Powder Diffraction X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Powder Diffraction X; if not, write to the Free Software Foundation, Inc., 59 Temple
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
// ******************************************************************************
package pdx.pawley;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;

/**
 * Messages produced by operations that log a problem and carry on rather than throw. Each entry
 * has already been logged; the Diagnostics returns them to the caller as a value.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Diagnostics {

  private static final Diagnostics EMPTY = new Diagnostics(Collections.emptyList());

  private final List<Entry> entries;

  private Diagnostics(List<Entry> entries) {
    this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
  }

  /**
   * Diagnostics without any entries.
   *
   * @return the empty Diagnostics.
   */
  public static Diagnostics empty() {
    return EMPTY;
  }

  /**
   * Diagnostics holding a single entry.
   *
   * @param level the severity.
   * @param message the message.
   * @return a new Diagnostics.
   */
  public static Diagnostics of(Level level, String message) {
    return new Diagnostics(Collections.singletonList(new Entry(level, message)));
  }

  public List<Entry> getEntries() {
    return entries;
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * Count the entries at a given level.
   *
   * @param level the severity.
   * @return the number of entries at that level.
   */
  public int count(Level level) {
    int n = 0;
    for (Entry entry : entries) {
      if (entry.level.equals(level)) {
        n++;
      }
    }
    return n;
  }

  public boolean hasErrors() {
    return count(Level.SEVERE) > 0;
  }

  public boolean hasWarnings() {
    return count(Level.WARNING) > 0;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    if (entries.isEmpty()) {
      return " No diagnostics.";
    }
    StringBuilder sb = new StringBuilder();
    for (Entry entry : entries) {
      sb.append(entry).append("\n");
    }
    return sb.toString();
  }

  /** A single diagnostic message. */
  public static final class Entry {

    private final Level level;
    private final String message;

    public Entry(Level level, String message) {
      this.level = level;
      this.message = message;
    }

    public Level getLevel() {
      return level;
    }

    public String getMessage() {
      return message;
    }

    @Override
    public String toString() {
      return format(" %s:%s", level, message);
    }
  }
}
