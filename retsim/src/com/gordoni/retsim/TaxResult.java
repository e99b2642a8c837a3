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

public class TaxResult
{
        public final double taxable_social_security;
        public final double agi;
        public final double magi;
        public final double federal_ordinary;
        public final double federal_capital_gains;
        public final double niit;
        public final double state;

        public TaxResult(double taxable_social_security, double agi, double magi, double federal_ordinary, double federal_capital_gains, double niit, double state)
        {
                this.taxable_social_security = taxable_social_security;
                this.agi = agi;
                this.magi = magi;
                this.federal_ordinary = federal_ordinary;
                this.federal_capital_gains = federal_capital_gains;
                this.niit = niit;
                this.state = state;
        }

        public double federal()
        {
                return federal_ordinary + federal_capital_gains + niit;
        }

        public double total()
        {
                return federal() + state;
        }
}
