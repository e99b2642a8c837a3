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

public enum CareType
{
        HOME(0.40, 0.6),
        ASSISTED(0.35, 0.8),
        NURSING(0.20, 1.2),
        MEMORY(0.05, 1.4);

        public final double weight; // Probability an episode is of this type.
        public final double cost_multiplier; // Relative to the average annual cost of care.

        CareType(double weight, double cost_multiplier)
        {
                this.weight = weight;
                this.cost_multiplier = cost_multiplier;
        }

        public static CareType select(double u)
        {
                double cumulative = 0;
                for (CareType c : values())
                {
                        cumulative += c.weight;
                        if (u < cumulative)
                                return c;
                }
                return MEMORY;
        }
}
