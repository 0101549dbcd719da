package org.javai.asciidoc.diag;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps character offsets to 1-based line and column numbers.
 */
public final class LineIndex {

	private final String source;
	private final int[] lineStarts;

	public LineIndex(String source) {
		this.source = source;
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i < source.length(); i++) {
			if (source.charAt(i) == '\n') {
				starts.add(i + 1);
			}
		}
		this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
	}

	public int lineCount() {
		return lineStarts.length;
	}

	/**
	 * Returns the 1-based line containing {@code offset}. Offsets past the end map to the last line.
	 */
	public int line(int offset) {
		int low = 0;
		int high = lineStarts.length - 1;
		while (low < high) {
			int mid = (low + high + 1) >>> 1;
			if (lineStarts[mid] <= offset) {
				low = mid;
			} else {
				high = mid - 1;
			}
		}
		return low + 1;
	}

	/**
	 * Returns the 1-based column of {@code offset} within its line.
	 */
	public int column(int offset) {
		int clamped = Math.min(Math.max(offset, 0), source.length());
		return clamped - lineStarts[line(clamped) - 1] + 1;
	}

	public int lineStart(int line) {
		return lineStarts[line - 1];
	}

	/**
	 * Returns the text of a 1-based line without its line terminator.
	 */
	public String lineText(int line) {
		int start = lineStarts[line - 1];
		int end = line < lineStarts.length ? lineStarts[line] - 1 : source.length();
		if (end > start && source.charAt(end - 1) == '\r') {
			end--;
		}
		return source.substring(start, Math.max(start, end));
	}

	/**
	 * Formats an offset as {@code line:column}.
	 */
	public String position(int offset) {
		return line(offset) + ":" + column(offset);
	}
}
