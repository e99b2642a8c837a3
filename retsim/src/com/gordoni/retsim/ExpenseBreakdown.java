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

public class ExpenseBreakdown
{
        public final double essential;
        public final double discretionary;
        public final double healthcare;
        public final double ltc;
        public final double irmaa;

        public ExpenseBreakdown(double essential, double discretionary, double healthcare, double ltc, double irmaa)
        {
                this.essential = essential;
                this.discretionary = discretionary;
                this.healthcare = healthcare;
                this.ltc = ltc;
                this.irmaa = irmaa;
        }

        public double total()
        {
                return essential + discretionary + healthcare + ltc + irmaa;
        }
}
