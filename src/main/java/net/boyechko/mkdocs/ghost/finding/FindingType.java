/*
 * MkDocs-Ghost - Navigation and Link Auditing for MkDocs Documentation Trees
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
package net.boyechko.mkdocs.ghost.finding;

/** The kinds of finding an audit reports, each with the label of its report section. */
public enum FindingType {
    NAV_MISSING("Missing nav entries"),
    GHOST("Ghost files (orphans)"),
    HELP_MISSING("Missing help URLs"),
    BROKEN_LINK("Broken links"),
    MISSING_IMAGE("Missing images"),
    ORPHAN_IMAGE("Orphan images"),

    // Informational only
    FOOTNOTES("Pages with footnotes");

    private final String groupLabel;

    FindingType(String groupLabel) {
        this.groupLabel = groupLabel;
    }

    public String groupLabel() {
        return groupLabel;
    }

    /** Whether findings of this type count toward the issue total. */
    public boolean isIssue() {
        return this != FOOTNOTES;
    }
}
