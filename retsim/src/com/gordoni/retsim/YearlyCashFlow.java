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
 * Record of one simulated year.
 */
public class YearlyCashFlow
{
        public final int year;
        public final int age; // Primary person's age.
        public final Integer spouse_age; // Null for a single household.

        public final double tax_deferred;
        public final double tax_free;
        public final double capital_gains;
        public final double cash;
        public final double portfolio;

        public final double social_security;
        public final double pension;
        public final double part_time;

        public final double rmd;
        public final double from_cash;
        public final double from_capital_gains;
        public final double from_tax_deferred;
        public final double from_tax_free;

        public final double federal_tax;
        public final double state_tax;
        public final double irmaa;

        public final double expenses; // Total spending need including long term care and IRMAA.
        public final double ltc_cost;
        public final double contribution;
        public final double net_cash_flow; // Income plus withdrawals less taxes and expenses.

        public final MarketRegime regime;
        public final SpendingState spending_state;
        public final double discretionary_multiplier;

        public YearlyCashFlow(int year, int age, Integer spouse_age, ScenarioState s, IncomeBreakdown income, WithdrawalPlan plan, TaxResult tax, ExpenseBreakdown exp, double contribution, MarketRegime regime, SpendingState spending_state, double discretionary_multiplier)
        {
                this.year = year;
                this.age = age;
                this.spouse_age = spouse_age;
                tax_deferred = s.tax_deferred;
                tax_free = s.tax_free;
                capital_gains = s.capital_gains;
                cash = s.cash;
                portfolio = s.total();
                social_security = income.social_security;
                pension = income.pension;
                part_time = income.part_time;
                rmd = plan.rmd;
                from_cash = plan.from_cash;
                from_capital_gains = plan.from_capital_gains;
                from_tax_deferred = plan.from_tax_deferred;
                from_tax_free = plan.from_tax_free;
                federal_tax = tax == null ? 0 : tax.federal();
                state_tax = tax == null ? 0 : tax.state;
                irmaa = exp == null ? 0 : exp.irmaa;
                expenses = exp == null ? 0 : exp.total();
                ltc_cost = exp == null ? 0 : exp.ltc;
                this.contribution = contribution;
                net_cash_flow = income.total() + plan.total() - federal_tax - state_tax - expenses;
                this.regime = regime;
                this.spending_state = spending_state;
                this.discretionary_multiplier = discretionary_multiplier;
        }

        public double withdrawal()
        {
                return from_cash + from_capital_gains + from_tax_deferred + from_tax_free;
        }

        public double total_income()
        {
                return social_security + pension + part_time;
        }

        public double total_tax()
        {
                return federal_tax + state_tax;
        }
}
