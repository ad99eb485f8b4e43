/**
 * Contract test kit for the turn loop.
 *
 * <p>Extend {@link com.ryuqq.conductor.testkit.contract.AbstractContractTest} to run orchestrators
 * against the in-memory adapters, with {@link com.ryuqq.conductor.testkit.contract.ScriptedAgent}s
 * standing in for real agents.</p>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.testkit.contract;
