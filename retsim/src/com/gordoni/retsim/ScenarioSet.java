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

import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the trials of a request on a fixed size worker pool and summarizes them.
 *
 * Results depend only on the parameters and seed: every scenario draws from its own generators and results are
 * combined in scenario order. A run either completes with every scenario or produces no result.
 */
public class ScenarioSet
{
        private static final Logger logger = LoggerFactory.getLogger(ScenarioSet.class);
        private final DecimalFormat f1f = new DecimalFormat("0.0");

        private final Config config;

        public ScenarioSet(Config config)
        {
                config.validate();
                this.config = config;
        }

        public SimulationResult run(SimulationParameters params) throws InterruptedException
        {
                long start = System.currentTimeMillis();
                logger.info("Simulating {} scenarios, seed {}", params.iterations, params.seed);

                VitalStats vital_stats = new VitalStats(config.life_table);
                RandomContext random = new RandomContext(params.seed, config.antithetic);

                ExecutorService executor;
                try
                {
                        executor = Executors.newFixedThreadPool(config.workers);
                }
                catch (RuntimeException e)
                {
                        throw new SimulationUnavailableException("Unable to start worker pool", e);
                }

                SimulationResult result;
                try
                {
                        Returns returns = new Returns(params, config, random, params.iterations);
                        Scenario scenario = new Scenario(params, config, returns, vital_stats, random, params.ltc.enabled, Double.NaN);
                        ScenarioResult[] results = simulate(executor, scenario, params.iterations);

                        LtcImpact ltc_impact = null;
                        if (params.ltc.enabled)
                        {
                                Scenario counterfactual = new Scenario(params, config, returns, vital_stats, random, false, Double.NaN);
                                ScenarioResult[] without = simulate(executor, counterfactual, params.iterations);
                                ltc_impact = ltc_impact(results, without);
                        }

                        double swr = Double.NaN;
                        boolean swr_low_confidence = false;
                        if (config.safe_withdrawal_rate)
                        {
                                SwrResult s = swr_search(executor, params, vital_stats, random);
                                swr = s.rate;
                                swr_low_confidence = s.low_confidence;
                        }

                        result = summarize(params, returns, scenario, results, swr, swr_low_confidence, ltc_impact);
                }
                catch (Exception | Error e)
                {
                        executor.shutdownNow();
                        throw e;
                }
                executor.shutdown();

                double elapsed = (System.currentTimeMillis() - start) / 1000.0;
                logger.info("Simulation done: {} seconds, success probability {}", f1f.format(elapsed), result.probability_of_success);

                return result;
        }

        private ScenarioResult[] simulate(ExecutorService executor, final Scenario scenario, final int n) throws InterruptedException
        {
                final ScenarioResult[] results = new ScenarioResult[n];
                final int per_task = (int) Math.ceil(n / (double) config.tasks);
                List<Callable<Integer>> tasks = new ArrayList<Callable<Integer>>();
                for (int i0 = 0; i0 < n; i0 += per_task)
                {
                        final int fi0 = i0;
                        tasks.add(new Callable<Integer>()
                        {
                                public Integer call()
                                {
                                        int i1 = Math.min(n, fi0 + per_task);
                                        for (int i = fi0; i < i1; i++)
                                                results[i] = scenario.run(i, false);
                                        return null;
                                }
                        });
                }

                invoke_all(executor, tasks);

                return results;
        }

        private void invoke_all(ExecutorService executor, List<Callable<Integer>> tasks) throws InterruptedException
        {
                List<Future<Integer>> future_tasks;
                try
                {
                        future_tasks = executor.invokeAll(tasks); // Will block until all tasks are finished
                }
                catch (RejectedExecutionException e)
                {
                        throw new SimulationUnavailableException("Worker pool rejected the run", e);
                }
                // If a task dies due to an assertion error, it can't be caught within the task, so we probe for it here.
                for (Future<Integer> f : future_tasks)
                {
                        try
                        {
                                f.get();
                        }
                        catch (ExecutionException e)
                        {
                                Throwable cause = e.getCause();
                                if (cause instanceof RuntimeException)
                                        throw (RuntimeException) cause;
                                else if (cause instanceof Error)
                                        throw (Error) cause;
                                else
                                        throw new SimulationException("Scenario failed", cause);
                        }
                }
        }

        private static double success_rate(ScenarioResult[] results)
        {
                int valid = 0;
                int success = 0;
                for (ScenarioResult r : results)
                        if (r.valid)
                        {
                                valid++;
                                if (r.success)
                                        success++;
                        }
                return valid == 0 ? 0 : success / (double) valid;
        }

        private static LtcImpact ltc_impact(ScenarioResult[] with, ScenarioResult[] without)
        {
                int valid = 0;
                int occurred = 0;
                double cost = 0;
                for (ScenarioResult r : with)
                        if (r.valid)
                        {
                                valid++;
                                if (r.ltc_occurred)
                                {
                                        occurred++;
                                        cost += r.ltc_cost;
                                }
                        }
                double probability = valid == 0 ? 0 : occurred / (double) valid;
                double average_cost = occurred == 0 ? 0 : cost / occurred;
                return new LtcImpact(probability, average_cost, success_rate(with), success_rate(without));
        }

        private static class SwrResult
        {
                final double rate;
                final boolean low_confidence;

                SwrResult(double rate, boolean low_confidence)
                {
                        this.rate = rate;
                        this.low_confidence = low_confidence;
                }
        }

        private double probe(ExecutorService executor, SimulationParameters params, Returns returns, VitalStats vital_stats, RandomContext random, double rate) throws InterruptedException
        {
                Scenario probe = new Scenario(params, config, returns, vital_stats, random, params.ltc.enabled, rate);
                return success_rate(simulate(executor, probe, config.swr_iterations));
        }

        /**
         * Bisect for the highest withdrawal rate, as a fraction of starting assets inflated each year, whose success
         * probability reaches swr_target. All probes share the same scenarios so the search is monotone in the rate.
         */
        private SwrResult swr_search(ExecutorService executor, SimulationParameters params, VitalStats vital_stats, RandomContext random) throws InterruptedException
        {
                Returns returns = new Returns(params, config, random, config.swr_iterations);
                double low = config.swr_min;
                double high = config.swr_max;
                if (probe(executor, params, returns, vital_stats, random, high) >= config.swr_target)
                        return new SwrResult(high, true);
                int iterations = 0;
                while (high - low > config.swr_tolerance && iterations < config.swr_max_iterations)
                {
                        double mid = (high + low) / 2;
                        if (probe(executor, params, returns, vital_stats, random, mid) >= config.swr_target)
                                low = mid;
                        else
                                high = mid;
                        iterations++;
                }
                boolean converged = high - low <= config.swr_tolerance;
                if (!converged)
                        logger.warn("Safe withdrawal rate search did not converge after {} iterations: [{}, {}]", iterations, low, high);
                return new SwrResult(low, !converged || low <= config.swr_min);
        }

        private SimulationResult summarize(SimulationParameters params, Returns returns, Scenario scenario, ScenarioResult[] results, double swr, boolean swr_low_confidence, LtcImpact ltc_impact)
        {
                List<ScenarioResult> valid = new ArrayList<ScenarioResult>();
                int successful = 0;
                int failed = 0;
                int legacy = 0;
                double depletion_years = 0;
                for (ScenarioResult r : results)
                {
                        if (!r.valid)
                                continue;
                        valid.add(r);
                        if (r.success)
                                successful++;
                        else
                        {
                                failed++;
                                depletion_years += r.depletion_year;
                        }
                        if (r.legacy_met())
                                legacy++;
                }
                int n = valid.size();
                int excluded = results.length - n;
                if (excluded > 0)
                        logger.warn("{} of {} scenarios excluded as numerically unstable", excluded, results.length);

                double raw = n == 0 ? 0 : successful / (double) n;
                double standard_error = n == 0 ? 0 : Math.sqrt(raw * (1 - raw) / n);
                double probability = raw;
                if (config.control_variates && n > 1)
                        probability = control_variate_adjust(params, returns, valid, raw);

                double[] ending = new double[n];
                for (int i = 0; i < n; i++)
                        ending[i] = valid.get(i).ending_balance;
                double[] sorted = Utils.sorted(ending);

                List<YearlyCashFlow> cash_flows = new ArrayList<YearlyCashFlow>();
                if (n > 0)
                {
                        List<ScenarioResult> by_balance = new ArrayList<ScenarioResult>(valid);
                        Collections.sort(by_balance, new Comparator<ScenarioResult>()
                        {
                                public int compare(ScenarioResult a, ScenarioResult b)
                                {
                                        int c = Double.compare(a.ending_balance, b.ending_balance);
                                        return c != 0 ? c : Integer.compare(a.index, b.index);
                                }
                        });
                        int median = by_balance.get((int) Math.floor(0.5 * (n - 1))).index;
                        cash_flows = scenario.run(median, true).cash_flows;
                }

                return new SimulationResult(probability, raw, standard_error,
                        Utils.percentile(sorted, 0.10), Utils.percentile(sorted, 0.50), Utils.percentile(sorted, 0.90), n == 0 ? Double.NaN : Utils.mean(ending),
                        n == 0 ? 0 : legacy / (double) n,
                        swr, swr_low_confidence,
                        failed == 0 ? Double.NaN : depletion_years / failed,
                        successful, failed, excluded, results.length,
                        cash_flows, GuardrailStatistics.of(results), ltc_impact);
        }

        /**
         * Adjust the success rate using the mean early portfolio return as a control: its expectation is known
         * exactly, so the part of the sample's success rate explained by its sampling error can be removed.
         */
        private double control_variate_adjust(SimulationParameters params, Returns returns, List<ScenarioResult> valid, double raw)
        {
                SimpleRegression regression = new SimpleRegression();
                double[] x = new double[valid.size()];
                for (int i = 0; i < x.length; i++)
                {
                        ScenarioResult r = valid.get(i);
                        x[i] = r.control_statistic;
                        regression.addData(x[i], r.success ? 1 : 0);
                }
                double beta = regression.getSlope();
                if (Double.isNaN(beta))
                        beta = 0;
                double expected = returns.expected_control_statistic(params.allocation, params.household.primary().age);
                double adjusted = raw - beta * (Utils.mean(x) - expected);
                if (config.trace)
                        logger.debug("Control variate beta {} sample mean {} expected {}", beta, Utils.mean(x), expected);
                return Math.max(0, Math.min(1, adjusted));
        }
}
