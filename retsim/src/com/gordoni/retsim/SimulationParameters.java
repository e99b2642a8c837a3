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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical, validated, immutable input to the engine.
 *
 * Amounts are annual and in today's dollars unless noted otherwise. All coercion of loosely typed input happens
 * before a Builder is populated; nothing inside the simulation loop parses or defaults a value.
 */
public class SimulationParameters
{
        public final Household household;
        public final AssetBuckets assets;
        public final double annual_savings; // Added to the tax deferred bucket each year before retirement.

        public final double essential_expenses;
        public final double discretionary_expenses;
        public final double healthcare_expenses;
        public final double survivor_expense_fraction; // Essential and discretionary expenses retained after the first death.

        public final double general_inflation;
        public final double healthcare_inflation;
        public final double ss_cola;

        public final List<AssetClass> asset_classes;
        private final double[][] correlation;
        public final double cash_yield; // Return earned by the cash bucket.
        public final AllocationPolicy allocation;

        public final double withdrawal_rate; // Reference initial withdrawal rate for the guardrails, or 0 to use the first retirement year's rate.
        public final boolean guardrails;

        public final String state; // Two letter state of residence.
        public final double legacy_goal;
        public final LtcParameters ltc;
        public final boolean dynamic_mortality; // Sample death ages rather than use each person's fixed life expectancy.

        public final int iterations;
        public final long seed;

        private SimulationParameters(Builder b)
        {
                household = b.household;
                assets = b.assets;
                annual_savings = b.annual_savings;
                essential_expenses = b.essential_expenses;
                discretionary_expenses = b.discretionary_expenses;
                healthcare_expenses = b.healthcare_expenses;
                survivor_expense_fraction = b.survivor_expense_fraction;
                general_inflation = b.general_inflation;
                healthcare_inflation = b.healthcare_inflation;
                ss_cola = b.ss_cola;
                asset_classes = Collections.unmodifiableList(new ArrayList<AssetClass>(b.asset_classes));
                correlation = copy(b.correlation);
                cash_yield = b.cash_yield;
                allocation = b.allocation;
                withdrawal_rate = b.withdrawal_rate;
                guardrails = b.guardrails;
                state = b.state.toUpperCase();
                legacy_goal = b.legacy_goal;
                ltc = b.ltc;
                dynamic_mortality = b.dynamic_mortality;
                iterations = b.iterations;
                seed = b.seed;
        }

        public double[][] correlation()
        {
                return copy(correlation);
        }

        private static double[][] copy(double[][] m)
        {
                double[][] c = new double[m.length][];
                for (int i = 0; i < m.length; i++)
                        c[i] = m[i].clone();
                return c;
        }

        public Builder to_builder()
        {
                Builder b = new Builder();
                b.household = household;
                b.assets = assets;
                b.annual_savings = annual_savings;
                b.essential_expenses = essential_expenses;
                b.discretionary_expenses = discretionary_expenses;
                b.healthcare_expenses = healthcare_expenses;
                b.survivor_expense_fraction = survivor_expense_fraction;
                b.general_inflation = general_inflation;
                b.healthcare_inflation = healthcare_inflation;
                b.ss_cola = ss_cola;
                b.asset_classes = new ArrayList<AssetClass>(asset_classes);
                b.correlation = correlation();
                b.cash_yield = cash_yield;
                b.allocation = allocation;
                b.withdrawal_rate = withdrawal_rate;
                b.guardrails = guardrails;
                b.state = state;
                b.legacy_goal = legacy_goal;
                b.ltc = ltc;
                b.dynamic_mortality = dynamic_mortality;
                b.iterations = iterations;
                b.seed = seed;
                return b;
        }

        public static class Builder
        {
                private Household household;
                private AssetBuckets assets = new AssetBuckets(0, 0, 0, 0, 0);
                private Double total_assets = null;
                private double annual_savings = 0;
                private double essential_expenses = 0;
                private double discretionary_expenses = 0;
                private double healthcare_expenses = 0;
                private double survivor_expense_fraction = 0.75;
                private double general_inflation = 0.025;
                private double healthcare_inflation = 0.05;
                private double ss_cola = 0.025;
                private List<AssetClass> asset_classes = new ArrayList<AssetClass>();
                private double[][] correlation = new double[0][];
                private double cash_yield = 0.02;
                private AllocationPolicy allocation;
                private double withdrawal_rate = 0;
                private boolean guardrails = true;
                private String state = "FL";
                private double legacy_goal = 0;
                private LtcParameters ltc = LtcParameters.disabled();
                private boolean dynamic_mortality = true;
                private int iterations = 1000;
                private long seed = 0;

                public Builder household(Household household) { this.household = household; return this; }
                public Builder assets(AssetBuckets assets) { this.assets = assets; return this; }
                public Builder total_assets(Double total_assets) { this.total_assets = total_assets; return this; }
                public Builder annual_savings(double annual_savings) { this.annual_savings = annual_savings; return this; }
                public Builder essential_expenses(double v) { this.essential_expenses = v; return this; }
                public Builder discretionary_expenses(double v) { this.discretionary_expenses = v; return this; }
                public Builder healthcare_expenses(double v) { this.healthcare_expenses = v; return this; }
                public Builder survivor_expense_fraction(double v) { this.survivor_expense_fraction = v; return this; }
                public Builder general_inflation(double v) { this.general_inflation = v; return this; }
                public Builder healthcare_inflation(double v) { this.healthcare_inflation = v; return this; }
                public Builder ss_cola(double v) { this.ss_cola = v; return this; }
                public Builder asset_classes(List<AssetClass> v) { this.asset_classes = new ArrayList<AssetClass>(v); return this; }
                public Builder correlation(double[][] v) { this.correlation = v; return this; }
                public Builder cash_yield(double v) { this.cash_yield = v; return this; }
                public Builder allocation(AllocationPolicy v) { this.allocation = v; return this; }
                public Builder withdrawal_rate(double v) { this.withdrawal_rate = v; return this; }
                public Builder guardrails(boolean v) { this.guardrails = v; return this; }
                public Builder state(String v) { this.state = v; return this; }
                public Builder legacy_goal(double v) { this.legacy_goal = v; return this; }
                public Builder ltc(LtcParameters v) { this.ltc = v; return this; }
                public Builder dynamic_mortality(boolean v) { this.dynamic_mortality = v; return this; }
                public Builder iterations(int v) { this.iterations = v; return this; }
                public Builder seed(long v) { this.seed = v; return this; }

                public SimulationParameters build()
                {
                        validate();
                        return new SimulationParameters(this);
                }

                private static void require(boolean ok, String field, String message)
                {
                        if (!ok)
                                throw new InvalidParameterException(field, message);
                }

                private static void non_negative(double v, String field)
                {
                        require(!Double.isNaN(v) && !Double.isInfinite(v), field, "must be a finite number");
                        require(v >= 0, field, "must not be negative, got " + v);
                }

                private static void rate(double v, String field)
                {
                        require(!Double.isNaN(v) && !Double.isInfinite(v), field, "must be a finite number");
                        require(v > -1, field, "must exceed -1, got " + v);
                }

                private void validate()
                {
                        require(household != null, "household", "is required");
                        for (Person p : household.people())
                        {
                                require(p.gender != null, "gender", "is required");
                                require(p.health != null, "health", "is required");
                                for (IncomeSource s : p.income)
                                {
                                        if (s instanceof SocialSecurity)
                                                non_negative(((SocialSecurity) s).fra_benefit, "social_security");
                                        else if (s instanceof Pension)
                                        {
                                                non_negative(((Pension) s).annual, "pension");
                                                rate(((Pension) s).cola, "pension_cola");
                                                double f = ((Pension) s).survivor_fraction;
                                                require(f >= 0 && f <= 1, "pension_survivor_fraction", "must be between 0 and 1");
                                        }
                                        else if (s instanceof PartTimeIncome)
                                                non_negative(((PartTimeIncome) s).annual, "part_time_income");
                                }
                        }

                        require(assets != null, "assets", "is required");
                        non_negative(assets.tax_deferred, "tax_deferred");
                        non_negative(assets.tax_free, "tax_free");
                        non_negative(assets.capital_gains, "capital_gains");
                        non_negative(assets.cash, "cash");
                        non_negative(assets.capital_gains_basis, "capital_gains_basis");
                        require(assets.capital_gains_basis <= assets.capital_gains + 1e-9, "capital_gains_basis", "must not exceed the capital gains bucket");
                        if (total_assets != null)
                        {
                                non_negative(total_assets, "total_assets");
                                require(Math.abs(total_assets - assets.total()) <= 0.01, "total_assets", "buckets sum to " + assets.total() + " not " + total_assets);
                        }
                        non_negative(annual_savings, "annual_savings");

                        non_negative(essential_expenses, "essential_expenses");
                        non_negative(discretionary_expenses, "discretionary_expenses");
                        non_negative(healthcare_expenses, "healthcare_expenses");
                        require(survivor_expense_fraction >= 0 && survivor_expense_fraction <= 1, "survivor_expense_fraction", "must be between 0 and 1");

                        rate(general_inflation, "inflation");
                        rate(healthcare_inflation, "healthcare_inflation");
                        rate(ss_cola, "ss_cola");

                        int n = asset_classes.size();
                        require(n > 0, "asset_classes", "at least one asset class is required");
                        for (AssetClass ac : asset_classes)
                        {
                                rate(ac.cagr, "cagr");
                                non_negative(ac.volatility, "volatility");
                        }
                        require(correlation.length == n, "correlation", "must be " + n + " by " + n);
                        for (int i = 0; i < n; i++)
                        {
                                require(correlation[i].length == n, "correlation", "must be " + n + " by " + n);
                                require(correlation[i][i] == 1, "correlation", "diagonal must be 1");
                                for (int j = 0; j < n; j++)
                                {
                                        require(Math.abs(correlation[i][j] - correlation[j][i]) < 1e-12, "correlation", "must be symmetric");
                                        require(Math.abs(correlation[i][j]) <= 1, "correlation", "entries must be between -1 and 1");
                                }
                        }
                        double[][] chol = Utils.cholesky_decompose(correlation);
                        for (int i = 0; i < n; i++)
                                require(chol[i][i] > 0, "correlation", "must be positive definite");
                        rate(cash_yield, "cash_yield");

                        require(allocation != null, "allocation", "is required");
                        for (double[] w : allocation.anchors())
                        {
                                require(w.length == n, "allocation", "must have one weight per asset class");
                                for (double x : w)
                                        require(x >= 0, "allocation", "weights must not be negative");
                                require(Math.abs(Utils.sum(w) - 1) < 1e-6, "allocation", "weights must sum to 1, got " + Utils.sum(w));
                        }

                        non_negative(withdrawal_rate, "withdrawal_rate");
                        require(state != null && state.length() > 0, "state", "is required");
                        non_negative(legacy_goal, "legacy_goal");

                        require(ltc != null, "ltc", "is required");
                        if (ltc.enabled)
                        {
                                require(ltc.lifetime_probability >= 0 && ltc.lifetime_probability <= 1, "ltc_probability", "must be between 0 and 1");
                                require(ltc.onset_min_age <= ltc.onset_max_age, "ltc_onset_max_age", "must not be less than ltc_onset_min_age");
                                non_negative(ltc.average_duration, "ltc_duration");
                                non_negative(ltc.average_annual_cost, "ltc_annual_cost");
                                rate(ltc.inflation, "ltc_inflation");
                                non_negative(ltc.daily_benefit, "ltc_daily_benefit");
                                non_negative(ltc.benefit_years, "ltc_benefit_years");
                                require(ltc.elimination_days >= 0, "ltc_elimination_days", "must not be negative");
                        }

                        require(iterations > 0, "iterations", "must be positive, got " + iterations);
                }
        }
}
