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

import java.util.HashMap;
import java.util.Map;

/**
 * Simplified flat state income tax.
 */
public class StateTax
{
        public final double income_rate;
        public final double capital_gains_rate;
        public final boolean taxes_social_security;
        public final double pension_exclusion; // Pension income excluded from state tax.

        private static final StateTax DEFAULT = new StateTax(0.05, 0.05, false, 0);
        private static final Map<String, StateTax> states = new HashMap<String, StateTax>();
        static
        {
                states.put("FL", new StateTax(0, 0, false, 0));
                states.put("TX", new StateTax(0, 0, false, 0));
                states.put("NV", new StateTax(0, 0, false, 0));
                states.put("WA", new StateTax(0, 0.07, false, 0));
                states.put("CA", new StateTax(0.133, 0.133, false, 0));
                states.put("NY", new StateTax(0.109, 0.109, false, 20000));
                states.put("MA", new StateTax(0.05, 0.05, false, 0));
                states.put("NC", new StateTax(0.0475, 0.0475, false, 0));
                states.put("AZ", new StateTax(0.025, 0.025, false, 2500));
                states.put("CO", new StateTax(0.044, 0.044, true, 24000));
        }

        public StateTax(double income_rate, double capital_gains_rate, boolean taxes_social_security, double pension_exclusion)
        {
                this.income_rate = income_rate;
                this.capital_gains_rate = capital_gains_rate;
                this.taxes_social_security = taxes_social_security;
                this.pension_exclusion = pension_exclusion;
        }

        public static StateTax lookup(String state)
        {
                StateTax st = states.get(state.toUpperCase());
                return st == null ? DEFAULT : st;
        }

        public double tax(double ordinary, double pension, double taxable_ss, double capital_gains)
        {
                double base = ordinary - Math.min(pension, pension_exclusion);
                if (taxes_social_security)
                        base += taxable_ss;
                return Math.max(0, base) * income_rate + Math.max(0, capital_gains) * capital_gains_rate;
        }
}
