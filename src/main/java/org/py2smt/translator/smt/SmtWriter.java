package org.py2smt.translator.smt;

/**
 * Serialises {@link SExpr} trees to SMT-LIB2 text.
 * <p>
 * List items are separated by single spaces, so an empty {@link SExpr.Sequence}
 * inside a list leaves an empty slot ({@code (ite c t )}). Sequence items are
 * separated by newlines.
 */
public final class SmtWriter {

	private SmtWriter() {}

	/**
	 * @param expr The expression to write.
	 * @return The SMT-LIB2 text.
	 */
	public static String write(SExpr expr) {
		StringBuilder sb = new StringBuilder();
		write(expr, sb);
		return sb.toString();
	}

	private static void write(SExpr expr, StringBuilder sb) {
		if (expr instanceof SExpr.Atom a) {
			sb.append(a.text());
		} else if (expr instanceof SExpr.SList l) {
			sb.append('(');
			for (int i = 0; i < l.items().size(); i++) {
				if (i > 0) sb.append(' ');
				write(l.items().get(i), sb);
			}
			sb.append(')');
		} else if (expr instanceof SExpr.Sequence s) {
			for (int i = 0; i < s.items().size(); i++) {
				if (i > 0) sb.append('\n');
				write(s.items().get(i), sb);
			}
		}
	}
}
