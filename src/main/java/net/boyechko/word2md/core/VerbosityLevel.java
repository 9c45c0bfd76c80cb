/*
 * Word2Md - Word Document to Markdown Conversion
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.word2md.core;

import ch.qos.logback.classic.Level;

/**
 * Defines the verbosity levels for output control.
 *
 * <p>Levels (from least to most verbose):
 *
 * <ul>
 *   <li>QUIET - Only errors
 *   <li>NORMAL - Phases and summary (default)
 *   <li>VERBOSE - Per-document details such as extracted media
 *   <li>DEBUG - All information including debug logs
 * </ul>
 */
public enum VerbosityLevel {
    QUIET(0, Level.ERROR),
    NORMAL(1, Level.INFO),
    VERBOSE(2, Level.INFO),
    DEBUG(3, Level.DEBUG);

    private final int level;
    private final Level logbackLevel;

    VerbosityLevel(int level, Level logbackLevel) {
        this.level = level;
        this.logbackLevel = logbackLevel;
    }

    public int getLevel() {
        return level;
    }

    /** Root logger level matching this verbosity. */
    public Level logbackLevel() {
        return logbackLevel;
    }

    /**
     * Check if output should be shown for the specified level.
     *
     * @param requiredLevel the minimum level required to show the output
     * @return true if output should be shown
     */
    public boolean shouldShow(VerbosityLevel requiredLevel) {
        return this.level >= requiredLevel.level;
    }
}
