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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class containing all the configuration parameters
 *
 * Engine tuning parameters are read directly by the engine. Household parameters are raw inputs; they reach the
 * engine only through simulation_parameters().
 */
public class Config
{
        private static final Logger logger = LoggerFactory.getLogger(Config.class);

        public String version = "java-1.0.0";

        public boolean trace = false; // Be chatty.

        public int workers = Runtime.getRuntime().availableProcessors(); // Number of worker threads to use.
        public int tasks = 100; // Break each batch of scenarios into this many concurrent tasks.

        public String life_table = "ssa-2021"; // Mortality table: "ssa-2021" or "cdc-2007".
        public int tax_year = 2025; // Calendar year of the first simulated year.
        public int irmaa_lag_years = 2; // IRMAA is determined by MAGI from this many years earlier.
        public int rmd_start_age = 73; // Age required minimum distributions start.
        public int ss_full_retirement_age = 67;
        public int planning_age = 95; // Age the guardrails plan to when deciding whether a spending cut is needed.

        public boolean antithetic = true; // Pair each scenario with one whose return noise is mirrored.
        public boolean stratified_sampling = true; // Latin hypercube sample the return noise of early years.
        public int stratified_years = 30; // Number of initial years to stratify.
        public boolean control_variates = false; // Adjust the success rate using the mean early portfolio return.
        public int control_variate_years = 10; // Years of returns in the control statistic.

        public boolean regime_switching = false; // Whether returns switch between normal and stress regimes.
        public double regime_normal_to_stress = 0.10; // Annual probability of entering the stress regime.
        public double regime_stress_to_normal = 0.50; // Annual probability of leaving the stress regime.
        public double regime_stress_mean_shift = 1.0; // Stress lowers each class's mean return by this many of its volatilities.
        public double regime_stress_vol_multiplier = 1.5; // Stress multiplies volatility by this.

        public double guardrail_upper = 0.20; // Cut when the withdrawal rate exceeds the initial rate by this fraction.
        public double guardrail_lower = 0.20; // Raise when the withdrawal rate is below the initial rate by this fraction.
        public double guardrail_cut = 0.10; // Fractional cut to discretionary spending.
        public double guardrail_raise = 0.10; // Fractional raise to discretionary spending.
        public double guardrail_floor = 0.5; // Minimum discretionary spending multiplier.
        public double guardrail_ceiling = 1.5; // Maximum discretionary spending multiplier.
        public int capital_preservation_min_years = 15; // No cuts once this few years remain to planning_age.

        public int gross_up_iterations = 100; // Maximum gross up search iterations per year.
        public double gross_up_tolerance = 0.01; // Dollars of after tax need that may go unmet.

        public boolean safe_withdrawal_rate = true; // Whether to search for the safe withdrawal rate.
        public double swr_target = 0.90; // Success probability the safe withdrawal rate must achieve.
        public double swr_min = 0.0;
        public double swr_max = 0.15;
        public double swr_tolerance = 0.0005;
        public int swr_max_iterations = 20;
        public int swr_iterations = 500; // Scenarios per safe withdrawal rate probe.

        // Household.

        public int age = 65;
        public int retirement_age = 65;
        public String gender = "male";
        public String health = "good"; // "excellent", "good", "fair", or "poor".
        public Integer life_expectancy = null; // Final age when dynamic_mortality is false, or none to use the life table.
        public double social_security = 0; // Annual benefit at full retirement age in today's dollars.
        public int ss_claim_age = 67;
        public double pension = 0; // Annual pension starting at retirement.
        public double pension_cola = 0;
        public double pension_survivor_fraction = 0;
        public double part_time_income = 0; // Annual part time earnings from retirement in today's dollars.
        public int part_time_end_age = 0;

        public boolean couple = false;
        public int spouse_age = 65;
        public int spouse_retirement_age = 65;
        public String spouse_gender = "female";
        public String spouse_health = "good";
        public Integer spouse_life_expectancy = null;
        public double spouse_social_security = 0;
        public int spouse_ss_claim_age = 67;
        public double spouse_pension = 0;
        public double spouse_pension_cola = 0;
        public double spouse_pension_survivor_fraction = 0;
        public double spouse_part_time_income = 0;
        public int spouse_part_time_end_age = 0;

        public double tax_deferred = 0;
        public double tax_free = 0;
        public double capital_gains = 0;
        public double capital_gains_basis_fraction = 1.0; // Cost basis as a fraction of the taxable account.
        public double cash = 0;
        public Double total_assets = null; // If given, must equal the sum of the buckets.
        public double annual_savings = 0; // Added to tax deferred each year before retirement, in today's dollars.

        public double essential_expenses = 0;
        public double discretionary_expenses = 0;
        public double healthcare_expenses = 0;
        public double survivor_expense_fraction = 0.75;

        public double inflation = 0.025;
        public double healthcare_inflation = 0.05;
        public double ss_cola = 0.025;

        public List<String> asset_class_names = Arrays.asList("stocks", "bonds");
        public double[] cagr = new double[] {0.07, 0.04};
        public double[] volatility = new double[] {0.16, 0.05};
        public double[] correlation = null; // Row major correlation matrix, or none for uncorrelated classes.
        public double cash_yield = 0.02;
        public double[] allocation = new double[] {0.6, 0.4};
        public double[] allocation_end = null; // If given, glide linearly from allocation to this.
        public int glide_start_age = 65;
        public int glide_end_age = 85;

        public double withdrawal_rate = 0; // Initial withdrawal rate for the guardrails, or 0 to use the first year's.
        public boolean guardrails = true;
        public String state = "FL";
        public double legacy_goal = 0; // Today's dollars.
        public boolean dynamic_mortality = true;

        public boolean ltc = false; // Model long term care risk.
        public double ltc_probability = 0.5;
        public int ltc_onset_min_age = 75;
        public int ltc_onset_max_age = 90;
        public double ltc_duration = 3.0;
        public double ltc_annual_cost = 75000;
        public double ltc_inflation = 0.045;
        public boolean ltc_insurance = false;
        public double ltc_daily_benefit = 200;
        public double ltc_benefit_years = 3;
        public int ltc_elimination_days = 90;
        public boolean ltc_inflation_rider = true;

        public int iterations = 1000;
        public long seed = 0;

        private static void require(boolean ok, String field, String message)
        {
                if (!ok)
                        throw new InvalidParameterException(field, message);
        }

        /**
         * Check the engine tuning parameters.
         */
        public void validate()
        {
                require(workers >= 1, "workers", "must be at least 1");
                require(tasks >= 1, "tasks", "must be at least 1");
                require(VitalStats.known_table(life_table), "life_table", "unknown table " + life_table);
                require(irmaa_lag_years >= 0, "irmaa_lag_years", "must not be negative");
                require(stratified_years >= 0, "stratified_years", "must not be negative");
                require(control_variate_years >= 1, "control_variate_years", "must be at least 1");
                require(regime_normal_to_stress >= 0 && regime_normal_to_stress <= 1, "regime_normal_to_stress", "must be a probability");
                require(regime_stress_to_normal >= 0 && regime_stress_to_normal <= 1, "regime_stress_to_normal", "must be a probability");
                require(regime_stress_vol_multiplier >= 0, "regime_stress_vol_multiplier", "must not be negative");
                require(guardrail_upper >= 0, "guardrail_upper", "must not be negative");
                require(guardrail_lower >= 0 && guardrail_lower <= 1, "guardrail_lower", "must be between 0 and 1");
                require(guardrail_cut >= 0 && guardrail_cut < 1, "guardrail_cut", "must be at least 0 and less than 1");
                require(guardrail_raise >= 0, "guardrail_raise", "must not be negative");
                require(guardrail_floor >= 0 && guardrail_floor <= 1, "guardrail_floor", "must be between 0 and 1");
                require(guardrail_ceiling >= 1, "guardrail_ceiling", "must be at least 1");
                require(gross_up_iterations >= 1, "gross_up_iterations", "must be at least 1");
                require(gross_up_tolerance >= 0, "gross_up_tolerance", "must not be negative");
                require(swr_target >= 0 && swr_target <= 1, "swr_target", "must be a probability");
                require(swr_min >= 0 && swr_min < swr_max, "swr_max", "search range must be non-empty");
                require(swr_tolerance > 0, "swr_tolerance", "must be positive");
                require(swr_max_iterations >= 1, "swr_max_iterations", "must be at least 1");
                require(swr_iterations >= 1, "swr_iterations", "must be at least 1");
        }

        private List<IncomeSource> income(double ss, int claim_age, double pension, double pension_cola, double survivor_fraction, double part_time, int part_time_end_age)
        {
                List<IncomeSource> income = new ArrayList<IncomeSource>();
                if (ss > 0)
                        income.add(new SocialSecurity(ss, claim_age, ss_full_retirement_age));
                if (pension > 0)
                        income.add(new Pension(pension, pension_cola, survivor_fraction));
                if (part_time > 0)
                        income.add(new PartTimeIncome(part_time, part_time_end_age));
                return income;
        }

        private static Gender gender(String field, String value)
        {
                try
                {
                        return Gender.parse(value);
                }
                catch (IllegalArgumentException e)
                {
                        throw new InvalidParameterException(field, e.getMessage());
                }
        }

        private static HealthStatus health(String field, String value)
        {
                try
                {
                        return HealthStatus.parse(value);
                }
                catch (IllegalArgumentException e)
                {
                        throw new InvalidParameterException(field, e.getMessage());
                }
        }

        /**
         * Coerce the household parameters into validated simulation parameters.
         */
        public SimulationParameters simulation_parameters()
        {
                Person primary = new Person(age, retirement_age, gender("gender", gender), health("health", health), life_expectancy,
                        income(social_security, ss_claim_age, pension, pension_cola, pension_survivor_fraction, part_time_income, part_time_end_age));
                Household household;
                if (couple)
                {
                        Person spouse = new Person(spouse_age, spouse_retirement_age, gender("spouse_gender", spouse_gender), health("spouse_health", spouse_health), spouse_life_expectancy,
                                income(spouse_social_security, spouse_ss_claim_age, spouse_pension, spouse_pension_cola, spouse_pension_survivor_fraction, spouse_part_time_income, spouse_part_time_end_age));
                        household = new CoupleHousehold(primary, spouse);
                }
                else
                        household = new SingleHousehold(primary);

                require(cagr != null && asset_class_names != null && cagr.length == asset_class_names.size(), "cagr", "must have one entry per asset class");
                require(volatility != null && volatility.length == asset_class_names.size(), "volatility", "must have one entry per asset class");
                List<AssetClass> classes = new ArrayList<AssetClass>();
                for (int a = 0; a < cagr.length; a++)
                        classes.add(new AssetClass(asset_class_names.get(a), cagr[a], volatility[a]));

                int n = classes.size();
                double[][] corr = new double[n][n];
                if (correlation == null)
                {
                        for (int a = 0; a < n; a++)
                                corr[a][a] = 1;
                }
                else
                {
                        require(correlation.length == n * n, "correlation", "must have " + (n * n) + " entries");
                        for (int a = 0; a < n; a++)
                                for (int b = 0; b < n; b++)
                                        corr[a][b] = correlation[a * n + b];
                }

                require(allocation != null, "allocation", "is required");
                AllocationPolicy policy;
                if (allocation_end == null)
                        policy = new StaticAllocation(allocation);
                else
                {
                        require(glide_start_age < glide_end_age, "glide_end_age", "must exceed glide_start_age");
                        policy = new LinearGlidePath(allocation, allocation_end, glide_start_age, glide_end_age);
                }

                require(capital_gains_basis_fraction >= 0 && capital_gains_basis_fraction <= 1, "capital_gains_basis_fraction", "must be between 0 and 1");
                AssetBuckets buckets = new AssetBuckets(tax_deferred, tax_free, capital_gains, capital_gains * capital_gains_basis_fraction, cash);

                LtcParameters ltc_params = new LtcParameters(ltc, ltc_probability, ltc_onset_min_age, ltc_onset_max_age, ltc_duration, ltc_annual_cost, ltc_inflation,
                        ltc_insurance, ltc_daily_benefit, ltc_benefit_years, ltc_elimination_days, ltc_inflation_rider);

                return new SimulationParameters.Builder()
                        .household(household)
                        .assets(buckets)
                        .total_assets(total_assets)
                        .annual_savings(annual_savings)
                        .essential_expenses(essential_expenses)
                        .discretionary_expenses(discretionary_expenses)
                        .healthcare_expenses(healthcare_expenses)
                        .survivor_expense_fraction(survivor_expense_fraction)
                        .general_inflation(inflation)
                        .healthcare_inflation(healthcare_inflation)
                        .ss_cola(ss_cola)
                        .asset_classes(classes)
                        .correlation(corr)
                        .cash_yield(cash_yield)
                        .allocation(policy)
                        .withdrawal_rate(withdrawal_rate)
                        .guardrails(guardrails)
                        .state(state)
                        .legacy_goal(legacy_goal)
                        .ltc(ltc_params)
                        .dynamic_mortality(dynamic_mortality)
                        .iterations(iterations)
                        .seed(seed)
                        .build();
        }

        private Map<String, Object> getAsMap()
        {
                Map<String, Object> params = new TreeMap<String, Object>();
                for (Field f : this.getClass().getDeclaredFields())
                {
                        if (Modifier.isStatic(f.getModifiers()))
                                continue;
                        try
                        {
                                params.put(f.getName(), f.get(this));
                        }
                        catch (IllegalAccessException e)
                        {
                                throw new IllegalStateException("Unable to read field " + f.getName(), e);
                        }
                }
                return params;
        }

        public void load_params(Map<String, Object> params, String in)
        {
                String[] lines = in.split("\\r?\\n");
                for (String line : lines)
                {
                        int comment_pos = line.indexOf("#");
                        if (comment_pos != -1)
                                line = line.substring(0, comment_pos);
                        line = line.trim(); // Handle empty lines containing whitespace.
                        if (line.equals(""))
                                continue;
                        String[] split_line = line.split("=", 2);
                        if (split_line.length != 2)
                                throw new IllegalArgumentException("Expecting name = value: " + line);

                        String name = split_line[0].trim();
                        String val = split_line[1].trim();
                        params.put(name, convertObjectFor(name, val));
                }
        }

        /**
         * Apply the parameters from the Map to the internal parameters
         *
         * @param params
         */
        public void applyParams(Map<String, Object> params)
        {
                for (String field : params.keySet())
                {
                        try
                        {
                                Field f = this.getClass().getDeclaredField(field);
                                if (Modifier.isStatic(f.getModifiers()))
                                        throw new IllegalArgumentException("Invalid field " + field);
                                f.set(this, params.get(field));
                        }
                        catch (NoSuchFieldException e)
                        {
                                throw new IllegalArgumentException("Invalid field " + field);
                        }
                        catch (IllegalAccessException e)
                        {
                                throw new IllegalArgumentException("Illegal access field " + field);
                        }
                }
        }

        /**
         * Dump all the parameters to the log
         */
        public void dumpParams()
        {
                Map<String, Object> params = getAsMap();
                for (String key : params.keySet())
                {
                        Object param = params.get(key);
                        String sparam;
                        if (param instanceof double[])
                                sparam = Arrays.toString((double[]) param);
                        else
                                sparam = String.valueOf(param);
                        logger.info("   {} = {}", key, sparam);
                }
        }

        /**
         * Convert the string raw parameter to an object compatible with the specified field
         *
         * @param field
         * @param raw
         * @return
         */
        private Object convertObjectFor(String field, String raw)
        {
                Field f;
                try
                {
                        f = this.getClass().getDeclaredField(field);
                }
                catch (NoSuchFieldException e)
                {
                        throw new IllegalArgumentException("No such field " + field);
                }
                if (Modifier.isStatic(f.getModifiers()))
                        throw new IllegalArgumentException("No such field " + field);
                try
                {
                        return convertObject(f.getType(), raw);
                }
                catch (RuntimeException e)
                {
                        throw new IllegalArgumentException("Value " + raw + " is not valid for the field " + field, e);
                }
        }

        /**
         * Convert the string raw parameter to an object of the specified class
         *
         * @param type
         * @param raw
         * @return
         */
        private Object convertObject(Class<?> type, String raw)
        {
                raw = raw.trim();

                if ("none".equalsIgnoreCase(raw) || "null".equalsIgnoreCase(raw))
                {
                        if (type.isPrimitive())
                                throw new IllegalArgumentException("Primitive value required");
                        return null;
                }

                if (type == String.class)
                {
                        if (raw.startsWith("\"") && raw.endsWith("\""))
                                raw = raw.substring(1, raw.length() - 1);
                        else if (raw.startsWith("\'") && raw.endsWith("\'"))
                                raw = raw.substring(1, raw.length() - 1);
                        else
                                throw new IllegalArgumentException("Unquoted string value");
                        return raw;
                }
                else if (type == boolean.class)
                {
                        if ("true".equalsIgnoreCase(raw) || "1".equals(raw))
                                return true;
                        else if ("false".equalsIgnoreCase(raw) || "0".equals(raw))
                                return false;
                        else
                                throw new IllegalArgumentException("Not a boolean");
                }
                else if (type == int.class || type == Integer.class)
                        return Integer.parseInt(raw);
                else if (type == long.class || type == Long.class)
                        return Long.parseLong(raw);
                else if (type == double.class || type == Double.class)
                        return Double.parseDouble(raw);
                else if (type == List.class)
                {
                        String slist = raw.substring(1, raw.length() - 1);
                        String sa[] = slist.split(",");
                        List<String> data = new ArrayList<String>();
                        if (sa.length > 1 || sa[0].trim().length() > 0)
                        {
                                for (String s : sa)
                                {
                                        data.add((String) convertObject(String.class, s));
                                }
                        }
                        return data;
                }
                else if (type == double[].class)
                {
                        if (!raw.startsWith("[") || !raw.endsWith("]"))
                                throw new IllegalArgumentException("Expecting [list]");
                        String slist = raw.substring(1, raw.length() - 1);
                        String sa[] = slist.split(",");
                        double[] data;
                        if (sa.length > 1 || sa[0].trim().length() > 0)
                        {
                                data = new double[sa.length];
                                int idx = 0;
                                for (String s : sa)
                                {
                                        data[idx++] = (Double) convertObject(double.class, s);
                                }
                        }
                        else
                        {
                                data = new double[0];
                        }
                        return data;
                }
                else
                        throw new IllegalArgumentException("Unsupported field type " + type.getName());
        }
}
