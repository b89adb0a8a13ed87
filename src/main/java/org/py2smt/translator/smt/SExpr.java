package org.py2smt.translator.smt;

import java.util.Arrays;
import java.util.List;

/**
 * Output representation of the translator: SMT-LIB2 s-expressions, built as a
 * tree and serialised once by {@link SmtWriter}.
 */
public sealed interface SExpr permits SExpr.Atom, SExpr.SList, SExpr.Sequence {

	/** A sequence without items; serialises to the empty string. */
	Sequence EMPTY = new Sequence(List.of());

	/**
	 * A symbol or literal, written as is.
	 * @param text The token text.
	 */
	record Atom(String text) implements SExpr {}

	/**
	 * A parenthesised application, {@code (head arg ...)}.
	 * @param items The head followed by the arguments.
	 */
	record SList(List<SExpr> items) implements SExpr {
		public SList {
			items = List.copyOf(items);
		}
	}

	/**
	 * Sibling expressions written one per line. This is how the legacy layout
	 * places {@code let} forms and statements that follow a conditional next
	 * to each other instead of nesting them.
	 * @param items The sibling expressions in source order.
	 */
	record Sequence(List<SExpr> items) implements SExpr {
		public Sequence {
			items = List.copyOf(items);
		}
	}

	static Atom atom(String text) {
		return new Atom(text);
	}

	static SList list(SExpr... items) {
		return new SList(Arrays.asList(items));
	}

	static SList list(List<SExpr> items) {
		return new SList(items);
	}
}
