package my.fundamentalagent.app.scoring;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Piecewise-linear mapping from a raw metric value to a sub-score in [0, 1]. Values left of the first
 * point take the first point's score, values right of the last point take the last point's score,
 * values in between are interpolated linearly between neighbouring points.
 */
public final class ScoringCurve {
	private final List<Point> points;

	private ScoringCurve(List<Point> points) {
		this.points = points;
	}

	public static ScoringCurve of(List<Point> points) {
		if (points == null || points.isEmpty()) {
			throw new IllegalArgumentException("A scoring curve needs at least one point");
		}
		List<Point> sorted = new ArrayList<>();
		for (Point point : points) {
			if (point == null || !Double.isFinite(point.x()) || !Double.isFinite(point.y())) {
				throw new IllegalArgumentException("Scoring curve points must be finite");
			}
			if (point.y() < 0.0d || point.y() > 1.0d) {
				throw new IllegalArgumentException("Scoring curve score must be within [0, 1]: " + point.y());
			}
			sorted.add(point);
		}
		sorted.sort(Comparator.comparingDouble(Point::x));
		for (int i = 1; i < sorted.size(); i++) {
			if (sorted.get(i).x() == sorted.get(i - 1).x()) {
				throw new IllegalArgumentException("Scoring curve has duplicate x: " + sorted.get(i).x());
			}
		}
		return new ScoringCurve(List.copyOf(sorted));
	}

	/** Rises linearly from 0 at {@code poor} to 1 at {@code excellent}; works in either direction. */
	public static ScoringCurve linear(double poor, double excellent) {
		return of(List.of(new Point(poor, 0.0d), new Point(excellent, 1.0d)));
	}

	/** Zero outside (zeroLow, zeroHigh), one on [idealLow, idealHigh], linear in between. */
	public static ScoringCurve peaked(double zeroLow, double idealLow, double idealHigh, double zeroHigh) {
		return of(List.of(
				new Point(zeroLow, 0.0d),
				new Point(idealLow, 1.0d),
				new Point(idealHigh, 1.0d),
				new Point(zeroHigh, 0.0d)
		));
	}

	public double evaluate(double value) {
		Point first = points.get(0);
		if (value <= first.x()) {
			return first.y();
		}
		Point last = points.get(points.size() - 1);
		if (value >= last.x()) {
			return last.y();
		}
		for (int i = 1; i < points.size(); i++) {
			Point right = points.get(i);
			if (value <= right.x()) {
				Point left = points.get(i - 1);
				double fraction = (value - left.x()) / (right.x() - left.x());
				return clamp(left.y() + fraction * (right.y() - left.y()));
			}
		}
		return last.y();
	}

	public List<Point> points() {
		return points;
	}

	private static double clamp(double value) {
		if (value < 0.0d) return 0.0d;
		if (value > 1.0d) return 1.0d;
		return value;
	}

	public record Point(double x, double y) {
	}
}
