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
 * Income tax owed for one year.
 */
public class TaxEngine
{
        /**
         * Portion of Social Security benefits subject to income tax, from 0 to 85%, by the provisional income test.
         */
        public static double taxable_social_security(TaxTables tables, FilingStatus status, double social_security, double other_income)
        {
                if (social_security <= 0)
                        return 0;
                double provisional = other_income + social_security / 2;
                double first = tables.ss_threshold(status, 0);
                double second = tables.ss_threshold(status, 1);
                if (provisional <= first)
                        return 0;
                else if (provisional <= second)
                        return Math.min(0.5 * (provisional - first), 0.5 * social_security);
                else
                        return Math.min(0.85 * social_security, 0.85 * (provisional - second) + Math.min(0.5 * social_security, 0.5 * (second - first)));
        }

        /**
         * @param ordinary ordinary income: pensions, earnings, and tax deferred withdrawals
         * @param pension the part of ordinary that is pension income
         * @param capital_gains realized long term gains
         */
        public static TaxResult compute(TaxTables tables, StateTax state, FilingStatus status, double ordinary, double pension, double social_security, double capital_gains)
        {
                double taxable_ss = taxable_social_security(tables, status, social_security, ordinary + capital_gains);
                double agi = ordinary + taxable_ss + capital_gains;
                double magi = agi;

                double deduction = tables.standard_deduction(status);
                double ordinary_agi = ordinary + taxable_ss;
                double taxable_ordinary = Math.max(0, ordinary_agi - deduction);
                double unused_deduction = Math.max(0, deduction - ordinary_agi);
                double taxable_gains = Math.max(0, capital_gains - unused_deduction);

                double federal_ordinary = tables.ordinary_tax(taxable_ordinary, status);
                double federal_cg = tables.capital_gains_tax(taxable_ordinary, taxable_gains, status);
                double niit = TaxTables.NIIT_RATE * Math.min(Math.max(0, capital_gains), Math.max(0, magi - tables.niit_threshold(status)));
                double state_tax = state.tax(ordinary, pension, taxable_ss, capital_gains);

                return new TaxResult(taxable_ss, agi, magi, federal_ordinary, federal_cg, niit, state_tax);
        }
}
