// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.edit;

import verdant.util.condition.Condition;

/**
 * A condition type indicating that an edit's range doesn't lie within the document.
 */
public final class EditRangeErrorCondition extends Condition {
    /**
     * Initializes a new range error for the range {@code start..end} of a document of the given length.
     */
    public EditRangeErrorCondition(final int start, final int end, final int documentLength) {
        super("Invalid edit range " + start + ".." + end);
        this.start = start;
        this.end = end;
        this.documentLength = documentLength;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    public int documentLength() {
        return documentLength;
    }

    @Override
    public String detailedMessage() {
        return message() + " in a document of " + documentLength + " characters";
    }

    private final int start;
    private final int end;
    private final int documentLength;
}
