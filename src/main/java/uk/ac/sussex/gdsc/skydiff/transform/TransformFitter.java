/*-
 * #%L
 * Genome Damage and Stability Centre ImageJ Plugins
 *
 * Software for microscopy image analysis
 * %%
 * Copyright (C) 2011 - 2019 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package uk.ac.sussex.gdsc.skydiff.transform;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Fits transforms to point correspondences.
 *
 * <p>Correspondences are provided as {@code [i][xa, ya, xb, yb]}; the fitted transform maps
 * (xb, yb) to (xa, ya). Methods return null when the points do not constrain the transform.
 */
final class TransformFitter {
  /** Squared distance below which two points are coincident. */
  private static final double COINCIDENT = 1e-6;
  /** Twice the triangle area below which three points are collinear. */
  private static final double COLLINEAR = 1e-3;

  /** No public constructor. */
  private TransformFitter() {}

  /**
   * Fit a transform to the minimal subset of correspondences.
   *
   * @param type the type
   * @param coords the correspondences
   * @param subset the indices of the subset
   * @return the transform (or null if degenerate)
   */
  static Transform fitMinimal(TransformType type, double[][] coords, int[] subset) {
    switch (type) {
      case RIGID:
      case SIMILARITY:
        return fitTwoPoint(type, coords[subset[0]], coords[subset[1]]);
      case HOMOGRAPHY:
        if (isCollinear(coords, subset, 0) || isCollinear(coords, subset, 2)) {
          return null;
        }
        return fitHomography(coords, subset);
      default:
        throw new IllegalArgumentException("Unknown transform type: " + type);
    }
  }

  /**
   * Fit a transform to the selected correspondences using least squares.
   *
   * @param type the type
   * @param coords the correspondences
   * @param inliers the flags for the correspondences to use
   * @return the transform (or null if degenerate)
   */
  static Transform fitLeastSquares(TransformType type, double[][] coords, boolean[] inliers) {
    final int[] subset = toIndices(inliers);
    if (subset.length < type.getMinimumCorrespondences()) {
      return null;
    }
    if (type == TransformType.HOMOGRAPHY) {
      return fitHomography(coords, subset);
    }
    return fitProcrustes(type, coords, subset);
  }

  private static int[] toIndices(boolean[] flags) {
    int count = 0;
    for (final boolean b : flags) {
      if (b) {
        count++;
      }
    }
    final int[] indices = new int[count];
    for (int i = 0, j = 0; i < flags.length; i++) {
      if (flags[i]) {
        indices[j++] = i;
      }
    }
    return indices;
  }

  /**
   * Closed form rotation (and scale) from the vector joining two points in each image.
   */
  private static Transform fitTwoPoint(TransformType type, double[] p1, double[] p2) {
    final double vax = p2[0] - p1[0];
    final double vay = p2[1] - p1[1];
    final double vbx = p2[2] - p1[2];
    final double vby = p2[3] - p1[3];
    final double lb2 = vbx * vbx + vby * vby;
    final double la2 = vax * vax + vay * vay;
    if (lb2 < COINCIDENT || la2 < COINCIDENT) {
      return null;
    }
    final double theta = Math.atan2(vbx * vay - vby * vax, vbx * vax + vby * vay);
    final double scale = type == TransformType.SIMILARITY ? Math.sqrt(la2 / lb2) : 1;
    return fromCentroids(type, scale, theta, (p1[0] + p2[0]) * 0.5, (p1[1] + p2[1]) * 0.5,
        (p1[2] + p2[2]) * 0.5, (p1[3] + p2[3]) * 0.5);
  }

  /**
   * Least squares rotation (Kabsch) and scale (Umeyama) in 2D.
   */
  private static Transform fitProcrustes(TransformType type, double[][] coords, int[] subset) {
    double cax = 0;
    double cay = 0;
    double cbx = 0;
    double cby = 0;
    for (final int i : subset) {
      cax += coords[i][0];
      cay += coords[i][1];
      cbx += coords[i][2];
      cby += coords[i][3];
    }
    final int n = subset.length;
    cax /= n;
    cay /= n;
    cbx /= n;
    cby /= n;

    double dot = 0;
    double cross = 0;
    double ssb = 0;
    for (final int i : subset) {
      final double ux = coords[i][2] - cbx;
      final double uy = coords[i][3] - cby;
      final double vx = coords[i][0] - cax;
      final double vy = coords[i][1] - cay;
      dot += ux * vx + uy * vy;
      cross += ux * vy - uy * vx;
      ssb += ux * ux + uy * uy;
    }
    if (ssb < COINCIDENT) {
      return null;
    }
    final double theta = Math.atan2(cross, dot);
    final double scale =
        type == TransformType.SIMILARITY ? Math.sqrt(dot * dot + cross * cross) / ssb : 1;
    return fromCentroids(type, scale, theta, cax, cay, cbx, cby);
  }

  private static Transform fromCentroids(TransformType type, double scale, double theta,
      double cax, double cay, double cbx, double cby) {
    final double c = scale * Math.cos(theta);
    final double s = scale * Math.sin(theta);
    final double tx = cax - (c * cbx - s * cby);
    final double ty = cay - (s * cbx + c * cby);
    return type == TransformType.SIMILARITY ? Transform.similarity(scale, theta, tx, ty)
        : Transform.rigid(theta, tx, ty);
  }

  /**
   * Check if any three of the four points are collinear.
   *
   * @param offset 0 for image A, 2 for image B
   */
  private static boolean isCollinear(double[][] coords, int[] subset, int offset) {
    for (int i = 0; i < 4; i++) {
      final double[] p1 = coords[subset[i == 0 ? 1 : 0]];
      final double[] p2 = coords[subset[i <= 1 ? 2 : 1]];
      final double[] p3 = coords[subset[i <= 2 ? 3 : 2]];
      final double area = (p2[offset] - p1[offset]) * (p3[offset + 1] - p1[offset + 1])
          - (p2[offset + 1] - p1[offset + 1]) * (p3[offset] - p1[offset]);
      if (Math.abs(area) < COLLINEAR) {
        return true;
      }
    }
    return false;
  }

  /**
   * Direct linear transform with Hartley normalisation of each point set.
   */
  private static Transform fitHomography(double[][] coords, int[] subset) {
    final double[] na = normalisation(coords, subset, 0);
    final double[] nb = normalisation(coords, subset, 2);
    if (na == null || nb == null) {
      return null;
    }
    final int n = subset.length;
    // At least 9 rows so the decomposition yields the full null space
    final double[][] a = new double[Math.max(9, 2 * n)][9];
    for (int k = 0; k < n; k++) {
      final double[] c = coords[subset[k]];
      final double u = (c[0] - na[0]) * na[2];
      final double v = (c[1] - na[1]) * na[2];
      final double x = (c[2] - nb[0]) * nb[2];
      final double y = (c[3] - nb[1]) * nb[2];
      final double[] r1 = a[2 * k];
      final double[] r2 = a[2 * k + 1];
      r1[0] = -x;
      r1[1] = -y;
      r1[2] = -1;
      r1[6] = u * x;
      r1[7] = u * y;
      r1[8] = u;
      r2[3] = -x;
      r2[4] = -y;
      r2[5] = -1;
      r2[6] = v * x;
      r2[7] = v * y;
      r2[8] = v;
    }
    final SingularValueDecomposition svd =
        new SingularValueDecomposition(new Array2DRowRealMatrix(a, false));
    // Singular values are in decreasing order
    final double[] hn = svd.getV().getColumn(8);

    // Denormalise: H = Ta^-1 Hn Tb
    final double sa = na[2];
    final double sb = nb[2];
    final RealMatrix taInv = new Array2DRowRealMatrix(
        new double[][] {{1 / sa, 0, na[0]}, {0, 1 / sa, na[1]}, {0, 0, 1}}, false);
    final RealMatrix tb = new Array2DRowRealMatrix(
        new double[][] {{sb, 0, -sb * nb[0]}, {0, sb, -sb * nb[1]}, {0, 0, 1}}, false);
    final RealMatrix hm = new Array2DRowRealMatrix(
        new double[][] {{hn[0], hn[1], hn[2]}, {hn[3], hn[4], hn[5]}, {hn[6], hn[7], hn[8]}},
        false);
    final double[][] h = taInv.multiply(hm).multiply(tb).getData();
    if (Math.abs(h[2][2]) < 1e-12) {
      return null;
    }
    final Transform t = Transform.homography(h);
    return t.isFinite() ? t : null;
  }

  /**
   * Compute the centroid and the scale mapping the mean distance from the centroid to sqrt(2).
   *
   * @return {cx, cy, scale} (or null if the points are coincident)
   */
  private static double[] normalisation(double[][] coords, int[] subset, int offset) {
    double cx = 0;
    double cy = 0;
    for (final int i : subset) {
      cx += coords[i][offset];
      cy += coords[i][offset + 1];
    }
    cx /= subset.length;
    cy /= subset.length;
    double mean = 0;
    for (final int i : subset) {
      mean += Math.hypot(coords[i][offset] - cx, coords[i][offset + 1] - cy);
    }
    mean /= subset.length;
    if (mean < COINCIDENT) {
      return null;
    }
    return new double[] {cx, cy, Math.sqrt(2) / mean};
  }
}
