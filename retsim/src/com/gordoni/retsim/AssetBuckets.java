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
 * Starting account balances by tax treatment.
 */
public class AssetBuckets
{
        public final double tax_deferred; // Traditional IRA / 401(k). Withdrawals are ordinary income.
        public final double tax_free; // Roth. Withdrawals are untaxed.
        public final double capital_gains; // Taxable brokerage account.
        public final double capital_gains_basis; // Cost basis of the taxable account.
        public final double cash; // Cash equivalents.

        public AssetBuckets(double tax_deferred, double tax_free, double capital_gains, double capital_gains_basis, double cash)
        {
                this.tax_deferred = tax_deferred;
                this.tax_free = tax_free;
                this.capital_gains = capital_gains;
                this.capital_gains_basis = capital_gains_basis;
                this.cash = cash;
        }

        public double total()
        {
                return tax_deferred + tax_free + capital_gains + cash;
        }
}
