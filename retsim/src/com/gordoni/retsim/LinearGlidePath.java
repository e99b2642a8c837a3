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

/**
 * Age based glide path moving linearly from one allocation to another.
 */
public class LinearGlidePath extends AllocationPolicy
{
        private final double[] start;
        private final double[] end;
        private final int start_age;
        private final int end_age;

        public LinearGlidePath(double[] start, double[] end, int start_age, int end_age)
        {
                this.start = start.clone();
                this.end = end.clone();
                this.start_age = start_age;
                this.end_age = end_age;
        }

        public double[] weights(int age)
        {
                double f;
                if (age <= start_age)
                        f = 0;
                else if (age >= end_age)
                        f = 1;
                else
                        f = (age - start_age) / (double) (end_age - start_age);
                double[] w = new double[start.length];
                for (int a = 0; a < w.length; a++)
                        w[a] = (1 - f) * start[a] + f * end[a];
                return w;
        }

        public double[][] anchors()
        {
                return new double[][] {start.clone(), end.clone()};
        }
}
