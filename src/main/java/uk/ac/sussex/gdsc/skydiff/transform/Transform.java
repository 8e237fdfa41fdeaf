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

import java.util.Arrays;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * A planar transform mapping image B coordinates into image A coordinates.
 *
 * <p>The parameters depend on the type:
 *
 * <ul>
 * <li>{@link TransformType#RIGID}: {theta, tx, ty}
 * <li>{@link TransformType#SIMILARITY}: {scale, theta, tx, ty}
 * <li>{@link TransformType#HOMOGRAPHY}: the 3x3 matrix in row-major order with h22 = 1
 * </ul>
 *
 * <p>Instances are immutable.
 */
public final class Transform {
  private final TransformType type;
  private final double[] parameters;

  private Transform(TransformType type, double[] parameters) {
    this.type = type;
    this.parameters = parameters;
  }

  /**
   * Create an identity transform of the given type.
   *
   * @param type the type
   * @return the transform
   */
  public static Transform identity(TransformType type) {
    switch (type) {
      case RIGID:
        return rigid(0, 0, 0);
      case SIMILARITY:
        return similarity(1, 0, 0, 0);
      case HOMOGRAPHY:
        return homography(new double[] {1, 0, 0, 0, 1, 0, 0, 0, 1});
      default:
        throw new IllegalArgumentException("Unknown transform type: " + type);
    }
  }

  /**
   * Create a rigid transform: rotation about the origin followed by translation.
   *
   * @param theta the rotation angle (radians)
   * @param tx the x translation
   * @param ty the y translation
   * @return the transform
   */
  public static Transform rigid(double theta, double tx, double ty) {
    return new Transform(TransformType.RIGID, new double[] {theta, tx, ty});
  }

  /**
   * Create a similarity transform: uniform scale and rotation about the origin followed by
   * translation.
   *
   * @param scale the scale
   * @param theta the rotation angle (radians)
   * @param tx the x translation
   * @param ty the y translation
   * @return the transform
   */
  public static Transform similarity(double scale, double theta, double tx, double ty) {
    return new Transform(TransformType.SIMILARITY, new double[] {scale, theta, tx, ty});
  }

  /**
   * Create a homography from the 3x3 matrix in row-major order. The matrix is normalised so
   * h22 = 1 when h22 is non-zero.
   *
   * @param matrix the matrix
   * @return the transform
   * @throws IllegalArgumentException if the matrix does not have 9 elements
   */
  public static Transform homography(double[] matrix) {
    if (matrix.length != 9) {
      throw new IllegalArgumentException("Homography requires 9 elements: " + matrix.length);
    }
    final double[] h = matrix.clone();
    final double h22 = h[8];
    if (h22 != 0 && h22 != 1) {
      for (int i = 0; i < 9; i++) {
        h[i] /= h22;
      }
    }
    return new Transform(TransformType.HOMOGRAPHY, h);
  }

  /**
   * Create a homography from the 3x3 matrix.
   *
   * @param matrix the matrix
   * @return the transform
   */
  public static Transform homography(double[][] matrix) {
    final double[] h = new double[9];
    for (int r = 0; r < 3; r++) {
      System.arraycopy(matrix[r], 0, h, r * 3, 3);
    }
    return homography(h);
  }

  /**
   * Gets the type.
   *
   * @return the type
   */
  public TransformType getType() {
    return type;
  }

  /**
   * Gets a copy of the parameters.
   *
   * @return the parameters
   */
  public double[] getParameters() {
    return parameters.clone();
  }

  /**
   * Map the point from image B into image A.
   *
   * @param x the x coordinate
   * @param y the y coordinate
   * @return the mapped point {x, y} (NaN if the point maps to infinity)
   */
  public double[] apply(double x, double y) {
    final double[] m = toArray();
    final double w = m[6] * x + m[7] * y + m[8];
    if (w == 0) {
      return new double[] {Double.NaN, Double.NaN};
    }
    return new double[] {(m[0] * x + m[1] * y + m[2]) / w, (m[3] * x + m[4] * y + m[5]) / w};
  }

  /**
   * Gets the 3x3 homogeneous matrix.
   *
   * @return the matrix
   */
  public double[][] toMatrix() {
    final double[] m = toArray();
    return new double[][] {{m[0], m[1], m[2]}, {m[3], m[4], m[5]}, {m[6], m[7], m[8]}};
  }

  /**
   * Gets the 3x3 homogeneous matrix in row-major order.
   *
   * @return the matrix
   */
  double[] toArray() {
    switch (type) {
      case RIGID:
        return similarityMatrix(1, parameters[0], parameters[1], parameters[2]);
      case SIMILARITY:
        return similarityMatrix(parameters[0], parameters[1], parameters[2], parameters[3]);
      case HOMOGRAPHY:
        return parameters.clone();
      default:
        throw new IllegalStateException("Unknown transform type: " + type);
    }
  }

  private static double[] similarityMatrix(double scale, double theta, double tx, double ty) {
    final double c = scale * Math.cos(theta);
    final double s = scale * Math.sin(theta);
    return new double[] {c, -s, tx, s, c, ty, 0, 0, 1};
  }

  /**
   * Checks if all the parameters are finite.
   *
   * @return true if finite
   */
  public boolean isFinite() {
    for (final double p : parameters) {
      if (!Double.isFinite(p)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Checks if the transform can be inverted.
   *
   * @return true if invertible
   */
  public boolean isInvertible() {
    if (!isFinite()) {
      return false;
    }
    switch (type) {
      case RIGID:
        return true;
      case SIMILARITY:
        return parameters[0] != 0;
      default:
        return new LUDecomposition(MatrixUtils.createRealMatrix(toMatrix())).getSolver()
            .isNonSingular();
    }
  }

  /**
   * Create the inverse transform mapping image A coordinates into image B. The type is
   * preserved.
   *
   * @return the inverse
   * @throws IllegalStateException if the transform is not invertible
   */
  public Transform inverse() {
    if (!isInvertible()) {
      throw new IllegalStateException("Transform is not invertible: " + this);
    }
    switch (type) {
      case RIGID:
        return inverseSimilarity(1, parameters[0], parameters[1], parameters[2], true);
      case SIMILARITY:
        return inverseSimilarity(parameters[0], parameters[1], parameters[2], parameters[3],
            false);
      default:
        final RealMatrix inv = new LUDecomposition(MatrixUtils.createRealMatrix(toMatrix()))
            .getSolver().getInverse();
        return homography(inv.getData());
    }
  }

  private static Transform inverseSimilarity(double scale, double theta, double tx, double ty,
      boolean rigid) {
    // x = s R^T (a - t) / s^2  =>  t' = -(1/s) R^T t
    final double c = Math.cos(theta);
    final double s = Math.sin(theta);
    final double is = 1.0 / scale;
    final double itx = -is * (c * tx + s * ty);
    final double ity = -is * (-s * tx + c * ty);
    return rigid ? rigid(-theta, itx, ity) : similarity(is, -theta, itx, ity);
  }

  @Override
  public String toString() {
    return type + Arrays.toString(parameters);
  }
}
