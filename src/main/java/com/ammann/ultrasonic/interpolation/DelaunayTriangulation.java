/* (C)2026 */
package com.ammann.ultrasonic.interpolation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Delaunay triangulation of a planar point set (Bowyer-Watson insertion).
 *
 * <p>Points are inserted into an enclosing super triangle one at a time; the cavity of
 * triangles whose circumcircle contains the new point is grown from the triangle that
 * contains it, so the cavity stays connected. Triangles touching the super triangle are
 * dropped at the end, leaving a triangulation of the convex hull.
 *
 * <p>All triangles are stored counter-clockwise. {@code neighbor(t, k)} is the triangle
 * across the edge opposite vertex {@code k} of triangle {@code t}, or {@code -1} on the hull.
 * Coordinates are normalized to the unit box internally; the caller's arrays are never modified.
 */
public final class DelaunayTriangulation
{
    private static final double SUPER_TRIANGLE_SCALE = 1_000.0;
    private static final double LOCATE_TOLERANCE = 1e-12;
    private static final double AREA_TOLERANCE = 1e-14;

    private final int[][] triangles;
    private final int[][] neighbors;
    private final int pointCount;

    private DelaunayTriangulation(int[][] triangles, int pointCount)
    {
        this.triangles = triangles;
        this.pointCount = pointCount;
        this.neighbors = buildNeighbors(triangles);
    }

    /**
     * Triangulates the given points. Duplicate positions must be removed by the caller.
     *
     * @param x point x coordinates
     * @param y point y coordinates
     * @return the triangulation; empty when the points are collinear or fewer than three
     */
    public static DelaunayTriangulation of(double[] x, double[] y)
    {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Coordinate arrays differ in length");
        }
        int n = x.length;
        if (n < 3) {
            return new DelaunayTriangulation(new int[0][], n);
        }

        double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            minX = Math.min(minX, x[i]);
            maxX = Math.max(maxX, x[i]);
            minY = Math.min(minY, y[i]);
            maxY = Math.max(maxY, y[i]);
        }
        // uniform scale keeps circles circles
        double scale = Math.max(maxX - minX, maxY - minY);
        if (scale <= 0) {
            return new DelaunayTriangulation(new int[0][], n);
        }

        double[] px = new double[n + 3];
        double[] py = new double[n + 3];
        for (int i = 0; i < n; i++) {
            px[i] = (x[i] - minX) / scale;
            py[i] = (y[i] - minY) / scale;
        }
        px[n] = -SUPER_TRIANGLE_SCALE;
        py[n] = -SUPER_TRIANGLE_SCALE;
        px[n + 1] = SUPER_TRIANGLE_SCALE;
        py[n + 1] = -SUPER_TRIANGLE_SCALE;
        px[n + 2] = 0.5;
        py[n + 2] = SUPER_TRIANGLE_SCALE;

        Builder builder = new Builder(px, py);
        builder.add(n, n + 1, n + 2);
        for (int i = 0; i < n; i++) {
            builder.insert(i);
        }

        List<int[]> kept = new ArrayList<>();
        for (Triangle t : builder.triangles) {
            if (!t.alive || t.a >= n || t.b >= n || t.c >= n) {
                continue;
            }
            if (orientation(px, py, t.a, t.b, t.c) <= AREA_TOLERANCE) {
                continue;
            }
            kept.add(new int[]{t.a, t.b, t.c});
        }
        return new DelaunayTriangulation(kept.toArray(new int[0][]), n);
    }

    public boolean isEmpty()
    {
        return triangles.length == 0;
    }

    public int triangleCount()
    {
        return triangles.length;
    }

    public int pointCount()
    {
        return pointCount;
    }

    /** Vertex indices of triangle {@code t}, counter-clockwise. */
    public int[] triangle(int t)
    {
        return triangles[t].clone();
    }

    /** Triangle across the edge opposite vertex {@code k} of triangle {@code t}, -1 on the hull. */
    public int neighbor(int t, int k)
    {
        return neighbors[t][k];
    }

    /**
     * Sorted adjacency lists: for each point, the points it shares an edge with.
     * Points that are not part of any triangle get an empty list.
     */
    public int[][] vertexNeighbors()
    {
        List<Set<Integer>> adjacency = new ArrayList<>(pointCount);
        for (int i = 0; i < pointCount; i++) {
            adjacency.add(new TreeSet<>());
        }
        for (int[] t : triangles) {
            for (int k = 0; k < 3; k++) {
                int u = t[k];
                int v = t[(k + 1) % 3];
                adjacency.get(u).add(v);
                adjacency.get(v).add(u);
            }
        }
        int[][] result = new int[pointCount][];
        for (int i = 0; i < pointCount; i++) {
            result[i] = adjacency.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return result;
    }

    private static int[][] buildNeighbors(int[][] triangles)
    {
        Map<Long, Integer> owner = new HashMap<>();
        for (int t = 0; t < triangles.length; t++) {
            for (int k = 0; k < 3; k++) {
                owner.put(edgeKey(triangles[t][k], triangles[t][(k + 1) % 3]), t);
            }
        }
        int[][] result = new int[triangles.length][3];
        for (int t = 0; t < triangles.length; t++) {
            int[] tri = triangles[t];
            for (int k = 0; k < 3; k++) {
                // edge opposite vertex k runs from tri[k+1] to tri[k+2]; its twin is reversed
                int from = tri[(k + 1) % 3];
                int to = tri[(k + 2) % 3];
                result[t][k] = owner.getOrDefault(edgeKey(to, from), -1);
            }
        }
        return result;
    }

    static long edgeKey(int from, int to)
    {
        return ((long) from << 32) | (to & 0xffffffffL);
    }

    static double orientation(double[] px, double[] py, int a, int b, int c)
    {
        return (px[b] - px[a]) * (py[c] - py[a]) - (px[c] - px[a]) * (py[b] - py[a]);
    }

    private static final class Triangle
    {
        final int a;
        final int b;
        final int c;
        final double centerX;
        final double centerY;
        final double radiusSquared;
        boolean alive = true;

        Triangle(int a, int b, int c, double[] px, double[] py)
        {
            this.a = a;
            this.b = b;
            this.c = c;
            double ax = px[a], ay = py[a];
            double bx = px[b] - ax, by = py[b] - ay;
            double cx = px[c] - ax, cy = py[c] - ay;
            double d = 2.0 * (bx * cy - by * cx);
            double b2 = bx * bx + by * by;
            double c2 = cx * cx + cy * cy;
            double ux = (cy * b2 - by * c2) / d;
            double uy = (bx * c2 - cx * b2) / d;
            this.centerX = ax + ux;
            this.centerY = ay + uy;
            this.radiusSquared = ux * ux + uy * uy;
        }

        int vertex(int k)
        {
            return k == 0 ? a : (k == 1 ? b : c);
        }

        boolean circumcircleContains(double x, double y)
        {
            double dx = x - centerX;
            double dy = y - centerY;
            return dx * dx + dy * dy < radiusSquared;
        }
    }

    private static final class Builder
    {
        final double[] px;
        final double[] py;
        final List<Triangle> triangles = new ArrayList<>();
        final Map<Long, Triangle> edges = new HashMap<>();

        Builder(double[] px, double[] py)
        {
            this.px = px;
            this.py = py;
        }

        void add(int a, int b, int c)
        {
            Triangle t = new Triangle(a, b, c, px, py);
            triangles.add(t);
            edges.put(edgeKey(a, b), t);
            edges.put(edgeKey(b, c), t);
            edges.put(edgeKey(c, a), t);
        }

        void remove(Triangle t)
        {
            t.alive = false;
            edges.remove(edgeKey(t.a, t.b));
            edges.remove(edgeKey(t.b, t.c));
            edges.remove(edgeKey(t.c, t.a));
        }

        Triangle twin(int from, int to)
        {
            return edges.get(edgeKey(to, from));
        }

        void insert(int p)
        {
            Triangle start = locate(p);
            if (start == null) {
                return;
            }

            Set<Triangle> cavity = new HashSet<>();
            Deque<Triangle> pending = new ArrayDeque<>();
            cavity.add(start);
            pending.push(start);
            while (!pending.isEmpty()) {
                Triangle t = pending.pop();
                for (int k = 0; k < 3; k++) {
                    Triangle n = twin(t.vertex(k), t.vertex((k + 1) % 3));
                    if (n != null && !cavity.contains(n) && n.circumcircleContains(px[p], py[p])) {
                        cavity.add(n);
                        pending.push(n);
                    }
                }
            }

            List<int[]> boundary = new ArrayList<>();
            for (Triangle t : cavity) {
                for (int k = 0; k < 3; k++) {
                    int from = t.vertex(k);
                    int to = t.vertex((k + 1) % 3);
                    Triangle n = twin(from, to);
                    if (n == null || !cavity.contains(n)) {
                        boundary.add(new int[]{from, to});
                    }
                }
            }

            cavity.forEach(this::remove);
            for (int[] edge : boundary) {
                add(edge[0], edge[1], p);
            }
        }

        /** Alive triangle containing point {@code p} (borders included); duplicates resolve to null. */
        Triangle locate(int p)
        {
            for (int i = triangles.size() - 1; i >= 0; i--) {
                Triangle t = triangles.get(i);
                if (!t.alive) {
                    continue;
                }
                if (orientation(px, py, t.a, t.b, p) >= -LOCATE_TOLERANCE
                        && orientation(px, py, t.b, t.c, p) >= -LOCATE_TOLERANCE
                        && orientation(px, py, t.c, t.a, p) >= -LOCATE_TOLERANCE) {
                    return t;
                }
            }
            return null;
        }
    }
}
