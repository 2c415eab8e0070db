// ******************************************************************************
//
// Title:       Powder Diffraction X.
// Description: Powder Diffraction X - Pawley Refinement of Powder Diffraction Data.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2021.
//
// This file is part of Powder Diffraction X.
//
// Powder Diffraction X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Powder Diffraction X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Powder Diffraction X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package pdx.crystal;

import java.util.Objects;

/**
 * The HKL class represents a single reflection.
 *
 * @author Timothy D. Fenn
 * @see ReflectionList
 * @since 1.0
 */
public class HKL {

  /** The h-index of the reflection. */
  protected int h;
  /** The k-index of the reflection. */
  protected int k;
  /** The l-index of the reflection. */
  protected int l;
  /**
   * The epsilon value of the reflection (the number of symmetry operators that leave it invariant),
   * which is zero for a systematic absence.
   */
  protected int epsilon;

  /** Constructor for HKL. */
  public HKL() {
  }

  /**
   * Constructor for HKL.
   *
   * @param h The h-index of the reflection.
   * @param k The k-index of the reflection.
   * @param l The l-index of the reflection.
   */
  public HKL(int h, int k, int l) {
    this.h = h;
    this.k = k;
    this.l = l;
  }

  /**
   * Constructor for HKL.
   *
   * @param hkl Miller indices as an array of length 3.
   */
  public HKL(int[] hkl) {
    this(hkl[0], hkl[1], hkl[2]);
  }

  /**
   * Negate the reflection.
   *
   * @return The Friedel mate.
   */
  public HKL neg() {
    return new HKL(-h, -k, -l);
  }

  /**
   * Evaluate the quadratic form hkl . mat . hkl for a symmetric matrix.
   *
   * @param mat a symmetric 3x3 matrix.
   * @return a double.
   */
  public double quadForm(double[][] mat) {
    return h * (h * mat[0][0] + 2 * (k * mat[0][1] + l * mat[0][2]))
        + k * (k * mat[1][1] + 2 * (l * mat[1][2]))
        + l * l * mat[2][2];
  }

  /**
   * Lexicographic comparison of the Miller indices.
   *
   * @param o Another reflection.
   * @return a negative integer, zero, or a positive integer.
   */
  public int compareIndices(HKL o) {
    if (h != o.h) {
      return Integer.compare(h, o.h);
    }
    if (k != o.k) {
      return Integer.compare(k, o.k);
    }
    return Integer.compare(l, o.l);
  }

  /**
   * getEpsilon
   *
   * @return an int.
   */
  public int getEpsilon() {
    return epsilon;
  }

  /**
   * setEpsilon
   *
   * @param eps an int.
   */
  public void setEpsilon(int eps) {
    this.epsilon = eps;
  }

  /**
   * The h-index of the reflection.
   *
   * @return The h-index of the reflection.
   */
  public int getH() {
    return h;
  }

  /**
   * Set the h-index of the reflection.
   *
   * @param h The h-index of the reflection.
   */
  public void setH(int h) {
    this.h = h;
  }

  /**
   * Get the k-index of the reflection.
   *
   * @return an int.
   */
  public int getK() {
    return k;
  }

  /**
   * Set the k-index of the reflection.
   *
   * @param k an int.
   */
  public void setK(int k) {
    this.k = k;
  }

  /**
   * Get the l-index of the reflection.
   *
   * @return an int.
   */
  public int getL() {
    return l;
  }

  /**
   * Set the l-index of the reflection.
   *
   * @param l an int.
   */
  public void setL(int l) {
    this.l = l;
  }

  /**
   * The Miller indices as a new array.
   *
   * @return {h, k, l}
   */
  public int[] toArray() {
    return new int[] {h, k, l};
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    HKL hkl = (HKL) o;
    return (h == hkl.getH() && k == hkl.getK() && l == hkl.getL());
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(h, k, l);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return h + " " + k + " " + l + " (eps: " + epsilon + ")";
  }
}
