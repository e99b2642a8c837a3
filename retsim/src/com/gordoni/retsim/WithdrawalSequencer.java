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
 * Tax aware ordering of withdrawals across the buckets.
 *
 * Any required minimum distribution comes first from the tax deferred bucket. The rest is drawn from cash, then the
 * taxable account, then tax deferred, and last tax free.
 */
public class WithdrawalSequencer
{
        public static WithdrawalPlan plan(ScenarioState s, double amount, double rmd)
        {
                double rmd_taken = Math.min(Math.max(rmd, 0), s.tax_deferred);
                double remaining = Math.max(0, amount - rmd_taken);

                double cash = Math.min(remaining, s.cash);
                remaining -= cash;
                double cg = Math.min(remaining, s.capital_gains);
                remaining -= cg;
                double gains = cg * s.gain_fraction();
                double td = Math.min(remaining, s.tax_deferred - rmd_taken);
                remaining -= td;
                double tf = Math.min(remaining, s.tax_free);
                remaining -= tf;

                return new WithdrawalPlan(rmd_taken, cash, cg, gains, rmd_taken + td, tf, remaining > 0);
        }

        public static void apply(ScenarioState s, WithdrawalPlan plan)
        {
                if (plan.from_capital_gains > 0)
                {
                        double f = plan.from_capital_gains / s.capital_gains;
                        s.capital_gains_basis = Math.max(0, s.capital_gains_basis * (1 - f));
                }
                s.cash = Math.max(0, s.cash - plan.from_cash);
                s.capital_gains = Math.max(0, s.capital_gains - plan.from_capital_gains);
                s.tax_deferred = Math.max(0, s.tax_deferred - plan.from_tax_deferred);
                s.tax_free = Math.max(0, s.tax_free - plan.from_tax_free);
        }
}
