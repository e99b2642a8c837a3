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
 * Effect of long term care risk on the plan.
 */
public class LtcImpact
{
        public final double probability; // Fraction of scenarios in which care was needed.
        public final double average_cost; // Average lifetime nominal out of pocket cost when care was needed.
        public final double success_with_ltc;
        public final double success_without_ltc; // Same scenarios with long term care not modeled.

        public LtcImpact(double probability, double average_cost, double success_with_ltc, double success_without_ltc)
        {
                this.probability = probability;
                this.average_cost = average_cost;
                this.success_with_ltc = success_with_ltc;
                this.success_without_ltc = success_without_ltc;
        }

        public double success_delta()
        {
                return success_with_ltc - success_without_ltc;
        }
}
