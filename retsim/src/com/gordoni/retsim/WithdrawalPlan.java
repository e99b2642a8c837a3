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
 * Amounts to take from each bucket in one year.
 */
public class WithdrawalPlan
{
        public static final WithdrawalPlan NONE = new WithdrawalPlan(0, 0, 0, 0, 0, 0, false);

        public final double rmd; // Required minimum distribution taken, included in from_tax_deferred.
        public final double from_cash;
        public final double from_capital_gains;
        public final double realized_gains;
        public final double from_tax_deferred;
        public final double from_tax_free;
        public final boolean exhausted; // The buckets could not supply the amount requested.

        public WithdrawalPlan(double rmd, double from_cash, double from_capital_gains, double realized_gains, double from_tax_deferred, double from_tax_free, boolean exhausted)
        {
                this.rmd = rmd;
                this.from_cash = from_cash;
                this.from_capital_gains = from_capital_gains;
                this.realized_gains = realized_gains;
                this.from_tax_deferred = from_tax_deferred;
                this.from_tax_free = from_tax_free;
                this.exhausted = exhausted;
        }

        public double total()
        {
                return from_cash + from_capital_gains + from_tax_deferred + from_tax_free;
        }
}
