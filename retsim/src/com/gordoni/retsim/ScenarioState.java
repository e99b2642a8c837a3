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
 * Mutable balances of one scenario. Never shared between scenarios.
 */
public class ScenarioState
{
        public double tax_deferred;
        public double tax_free;
        public double capital_gains;
        public double capital_gains_basis;
        public double cash;

        public ScenarioState(AssetBuckets start)
        {
                tax_deferred = start.tax_deferred;
                tax_free = start.tax_free;
                capital_gains = start.capital_gains;
                capital_gains_basis = start.capital_gains_basis;
                cash = start.cash;
        }

        public double total()
        {
                return tax_deferred + tax_free + capital_gains + cash;
        }

        /**
         * Fraction of the taxable account that is unrealized gain.
         */
        public double gain_fraction()
        {
                if (capital_gains <= 0)
                        return 0;
                return Math.max(0, 1 - capital_gains_basis / capital_gains);
        }

        /**
         * Apply a year's returns. The invested buckets share one allocation, so they earn the same return.
         */
        public void grow(double invested_return, double cash_return)
        {
                tax_deferred *= 1 + invested_return;
                tax_free *= 1 + invested_return;
                capital_gains *= 1 + invested_return;
                cash *= 1 + cash_return;
        }
}
