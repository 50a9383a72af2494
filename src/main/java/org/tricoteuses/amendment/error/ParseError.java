package org.tricoteuses.amendment.error;

import org.tricoteuses.amendment.tree.SourceSpan;

/**
 * Why an amendment sentence could not be turned into a result.
 */
public sealed interface ParseError {

    /**
     * Offset in the sentence the error points at.
     */
    int offset();

    String message();

    default Diagnostic toDiagnostic() {
        return Diagnostic.error(message(), SourceSpan.at(offset()));
    }

    /**
     * Neither a reference nor an action matched; {@code offset} is the furthest point reached.
     */
    record UnexpectedInput(int offset, String found, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + offset + ", expected " + expected;
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("unrecognized amendment", SourceSpan.of(offset, offset + Math.max(1, found.length())))
                             .withLabel("expected " + expected);
        }
    }

    /**
     * Input ended (or was blank) where more was expected.
     */
    record UnexpectedEof(int offset, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + offset + ", expected " + expected;
        }
    }

    /**
     * A reference parsed but no amendment verb follows it.
     */
    record MissingAction(int offset, SourceSpan referenceSpan) implements ParseError {
        @Override
        public String message() {
            return "Reference at " + referenceSpan + " is not followed by an amendment action";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("missing amendment action", SourceSpan.at(offset))
                             .withSecondaryLabel(referenceSpan, "reference parsed here")
                             .withHelp("expected a verb such as 'est remplacé par', 'est inséré' or 'est abrogé'");
        }
    }

    /**
     * Unexpected runtime fault while processing one block; other blocks are unaffected.
     */
    record ParserFault(int offset, String reason) implements ParseError {
        @Override
        public String message() {
            return "Parser fault: " + reason;
        }
    }
}
