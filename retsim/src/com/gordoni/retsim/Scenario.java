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
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single trial: one sampled lifetime of returns, deaths and care needs, simulated year by year.
 *
 * Each year: returns are drawn and applied, then guaranteed income and the spending need are projected, the
 * guardrails adjust discretionary spending, and the gross withdrawal is searched for that, net of tax, meets the need.
 * A scenario fails at the first year the need cannot be met. It keeps being simulated after that so its ending
 * balance is known, but later recovery does not make it a success.
 */
public class Scenario
{
        private static final Logger logger = LoggerFactory.getLogger(Scenario.class);

        private final SimulationParameters params;
        private final Config config;
        private final Returns returns;
        private final VitalStats vital_stats;
        private final RandomContext random;
        private final CashFlowProjector projector;
        private final StateTax state_tax;

        private final boolean ltc_enabled;
        private final double probe_rate; // Replace baseline spending with this fraction of starting assets, or NaN.
        private final boolean guardrails;

        public Scenario(SimulationParameters params, Config config, Returns returns, VitalStats vital_stats, RandomContext random, boolean ltc_enabled, double probe_rate)
        {
                this.params = params;
                this.config = config;
                this.returns = returns;
                this.vital_stats = vital_stats;
                this.random = random;
                this.projector = new CashFlowProjector(params);
                this.state_tax = StateTax.lookup(params.state);
                this.ltc_enabled = ltc_enabled;
                this.probe_rate = probe_rate;
                this.guardrails = params.guardrails && Double.isNaN(probe_rate);
        }

        private static Integer spouse_age(List<Person> people, int year, boolean[] alive)
        {
                if (people.size() < 2 || !alive[1])
                        return null;
                return people.get(1).age + year;
        }

        public ScenarioResult run(int index, boolean record)
        {
                RandomContext.ScenarioRandom sr = random.scenario(index);
                List<Person> people = params.household.people();
                Person primary = people.get(0);

                int[] death_ages = new int[people.size()];
                LtcEpisode[] episodes = new LtcEpisode[people.size()];
                int horizon = 0;
                for (int i = 0; i < people.size(); i++)
                {
                        Person p = people.get(i);
                        death_ages[i] = params.dynamic_mortality ? vital_stats.sample_death_age(p, sr.mortality) : vital_stats.fixed_death_age(p);
                        LtcEpisode episode = LtcModel.sample(p, params.ltc, params.state, sr.ltc);
                        episodes[i] = ltc_enabled ? episode : null;
                        horizon = Math.max(horizon, death_ages[i] - p.age);
                }

                ScenarioState s = new ScenarioState(params.assets);
                Guardrails gr = new Guardrails(config, params.withdrawal_rate);
                double starting_assets = params.assets.total();
                double[] magi = new double[horizon];
                List<YearlyCashFlow> flows = record ? new ArrayList<YearlyCashFlow>() : null;

                MarketRegime regime = MarketRegime.NORMAL;
                int control_years = config.control_variates ? config.control_variate_years : 0;
                double control_sum = 0;

                boolean failed = false;
                int depletion_year = -1;
                boolean valid = true;
                int invalid_year = -1;
                int cp_years = 0;
                int prosperity_years = 0;
                double min_multiplier = 1;
                double max_multiplier = 1;
                boolean ltc_occurred = false;
                double ltc_total = 0;

                int years = Math.max(horizon, control_years);
                for (int y = 0; y < years; y++)
                {
                        regime = returns.next_regime(regime, sr.regime);
                        ReturnDraw draw = returns.draw(sr, y, regime);
                        double invested_return = draw.portfolio_return(params.allocation.weights(primary.age + y));
                        if (y < control_years)
                                control_sum += invested_return;
                        if (y >= horizon)
                                continue;

                        double start_tax_deferred = s.tax_deferred;
                        s.grow(invested_return, params.cash_yield);
                        boolean[] alive = projector.alive(y, death_ages);
                        int age = primary.age + y;
                        double general = Math.pow(1 + params.general_inflation, y);

                        if (age < primary.retirement_age)
                        {
                                double contribution = params.annual_savings * general;
                                s.tax_deferred += contribution;
                                if (record)
                                        flows.add(new YearlyCashFlow(y, age, spouse_age(people, y, alive), s, new IncomeBreakdown(0, 0, 0), WithdrawalPlan.NONE, null, null, contribution, regime, gr.state(), gr.multiplier()));
                                if (!Utils.finite(s.total()))
                                {
                                        valid = false;
                                        invalid_year = y;
                                        break;
                                }
                                continue;
                        }

                        IncomeBreakdown income = projector.income(y, alive);
                        FilingStatus status = projector.filing_status(alive);
                        TaxTables tables = TaxTables.for_year(config.tax_year + y, params.general_inflation);

                        double ltc = 0;
                        if (ltc_enabled)
                        {
                                ltc = projector.ltc_cost(y, episodes, death_ages);
                                for (int i = 0; i < people.size(); i++)
                                        if (episodes[i] != null && episodes[i].active_fraction(people.get(i).age + y, death_ages[i]) > 0)
                                                ltc_occurred = true;
                                ltc_total += ltc;
                        }

                        double irmaa = 0;
                        int lag = config.irmaa_lag_years;
                        if (y >= lag && magi[y - lag] > 0)
                                irmaa = projector.medicare_enrollees(y, alive) * tables.irmaa_surcharge(magi[y - lag], status);

                        ExpenseBreakdown expenses;
                        if (!Double.isNaN(probe_rate))
                                expenses = new ExpenseBreakdown(income.total() + probe_rate * starting_assets * general, 0, 0, ltc, irmaa);
                        else
                        {
                                if (guardrails)
                                {
                                        double planned = projector.expenses(y, alive, gr.multiplier(), ltc, irmaa).total() - income.total();
                                        SpendingState st = gr.update(planned, s.total(), config.planning_age - age);
                                        if (st == SpendingState.CAPITAL_PRESERVATION)
                                                cp_years++;
                                        else if (st == SpendingState.PROSPERITY)
                                                prosperity_years++;
                                        min_multiplier = Math.min(min_multiplier, gr.multiplier());
                                        max_multiplier = Math.max(max_multiplier, gr.multiplier());
                                }
                                expenses = projector.expenses(y, alive, guardrails ? gr.multiplier() : 1, ltc, irmaa);
                        }

                        int rmd_age = projector.rmd_age(y, alive);
                        double rmd = rmd_age >= config.rmd_start_age ? start_tax_deferred / TaxTables.rmd_factor(rmd_age) : 0;

                        // Tax on guaranteed income alone is paid out of that income. The portfolio funds the rest of the
                        // need plus the extra tax its own withdrawals cause.
                        TaxResult base_tax = TaxEngine.compute(tables, state_tax, status, income.ordinary(), income.pension, income.social_security, 0);
                        double need = Math.max(0, expenses.total() - income.total());
                        double surplus = Math.max(0, income.total() - base_tax.total() - expenses.total());

                        // Gross up: raise the withdrawal by each remaining after tax shortfall until the need is met.
                        double gross = 0;
                        WithdrawalPlan plan = null;
                        TaxResult tax = null;
                        double deficit = 0;
                        for (int i = 0; i < config.gross_up_iterations; i++)
                        {
                                plan = WithdrawalSequencer.plan(s, gross, rmd);
                                tax = TaxEngine.compute(tables, state_tax, status, income.ordinary() + plan.from_tax_deferred, income.pension, income.social_security, plan.realized_gains);
                                double net = plan.total() - (tax.total() - base_tax.total());
                                deficit = need - net;
                                if (deficit <= config.gross_up_tolerance || plan.exhausted)
                                        break;
                                gross = plan.total() + deficit;
                        }
                        WithdrawalSequencer.apply(s, plan);
                        if (deficit < 0)
                                s.cash += -deficit; // Excess RMDs are kept as cash.
                        s.cash += surplus;
                        magi[y] = tax.magi;

                        if (deficit > config.gross_up_tolerance && !failed)
                        {
                                failed = true;
                                depletion_year = y;
                                if (config.trace)
                                        logger.debug("Scenario {} depleted in year {} at age {}", index, y, age);
                        }

                        if (record)
                                flows.add(new YearlyCashFlow(y, age, spouse_age(people, y, alive), s, income, plan, tax, expenses, 0, regime, gr.state(), guardrails ? gr.multiplier() : 1));

                        if (!Utils.finite(s.total(), tax.total(), need, deficit))
                        {
                                valid = false;
                                invalid_year = y;
                                break;
                        }
                }

                if (!valid)
                        logger.warn("Scenario {} numerically unstable in year {}; excluded", index, invalid_year);

                double legacy_target = params.legacy_goal * Math.pow(1 + params.general_inflation, horizon);
                double control = control_years > 0 ? control_sum / control_years : Double.NaN;
                return new ScenarioResult(index, valid, invalid_year, valid && !failed, depletion_year, horizon, s.total(), legacy_target, gr.cuts(), gr.raises(), cp_years, prosperity_years, min_multiplier, max_multiplier, ltc_occurred, ltc_total, control, flows);
        }
}
