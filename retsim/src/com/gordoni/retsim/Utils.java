/*
 * AACalc - Asset Allocation Calculator
 * Copyright (C) 2009, 2011-2017 Gordon Irlam
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.gordoni.retsim;

import java.util.Arrays;

public class Utils
{
        public static double dot_product(double[] v, double[] w)
        {
                assert(v.length == w.length);
                double r = 0.0;
                for (int i = 0; i < v.length; i++)
                        r += v[i] * w[i];
                return r;
        }

        public static double[] matrix_vector_product(double[][] a, double[] v)
        {
                double[] r = new double[a.length];
                for (int i = 0; i < a.length; i++)
                        r[i] = dot_product(a[i], v);
                return r;
        }

        public static double sum(double... vals)
        {
                double x = 0.0;
                for (double val : vals)
                        x += val;
                return x;
        }

        public static double mean(double... a)
        {
                return sum(a) / a.length;
        }

        /**
         * Value at fraction p through the sorted sample, using the lower index floor(p * (n - 1)).
         */
        public static double percentile(double[] sorted, double p)
        {
                if (sorted.length == 0)
                        return Double.NaN;
                int idx = (int) Math.floor(p * (sorted.length - 1));
                return sorted[idx];
        }

        public static double[] sorted(double[] vals)
        {
                double[] s = vals.clone();
                Arrays.sort(s);
                return s;
        }

        public static boolean finite(double... vals)
        {
                for (double v : vals)
                        if (Double.isNaN(v) || Double.isInfinite(v))
                                return false;
                return true;
        }

        public static double[][] cholesky_decompose(double[][] a)
        {
                double[][] l = new double[a.length][a.length];
                for (int i = 0; i < a.length; i++)
                {
                        for (int j = 0; j < i; j++)
                        {
                                double s = 0.0;
                                for (int k = 0; k < j; k++)
                                        s += l[i][k] * l[j][k];
                                l[i][j] = (a[i][j] - s) / l[j][j];
                        }
                        double s = 0.0;
                        for (int k = 0; k < i; k++)
                                s += l[i][k] * l[i][k];
                        l[i][i] = Math.sqrt(a[i][i] - s);
                }
                return l;
        }
}
