package pygen.util;

import java.util.Objects;

/**
 * A half-open range of byte offsets [start, end) into a module's source text.
 */
public class SourceSpan implements Comparable<SourceSpan> {
	private final int start;
	private final int end;

	public SourceSpan(int start, int end) {
		if (start < -1 || end < start) {
			throw new IllegalArgumentException("invalid source span " + start + ".." + end);
		}
		this.start = start;
		this.end = end;
	}

	public static SourceSpan unknown() {
		return new SourceSpan(-1, -1);
	}

	public boolean isUnknown() {
		return start < 0;
	}

	public SourceSpan combine(SourceSpan other) {
		if (isUnknown()) {
			return other;
		} else if (other.isUnknown()) {
			return this;
		}
		return new SourceSpan(Integer.min(start, other.start), Integer.max(end, other.end));
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SourceSpan that = (SourceSpan) o;
		return start == that.start &&
				end == that.end;
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, end);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceSpan [UNKNOWN]";
		}
		return "SourceSpan [start=" + start + ", end=" + end + "]";
	}

	@Override
	public int compareTo(SourceSpan o) {
		int comparedStart = Integer.compare(start, o.start);
		if (comparedStart != 0) {
			return comparedStart;
		}
		return Integer.compare(end, o.end);
	}
}
