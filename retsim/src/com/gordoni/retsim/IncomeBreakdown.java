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
 * Guaranteed income for one year by source.
 */
public class IncomeBreakdown
{
        public final double social_security;
        public final double pension;
        public final double part_time;

        public IncomeBreakdown(double social_security, double pension, double part_time)
        {
                this.social_security = social_security;
                this.pension = pension;
                this.part_time = part_time;
        }

        public double ordinary()
        {
                return pension + part_time;
        }

        public double total()
        {
                return social_security + pension + part_time;
        }
}
