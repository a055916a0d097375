/**
 * Contract test bases for GuardMap SPI implementations.
 *
 * <p>Adapter modules extend these classes to prove they honour the behaviour
 * the guard layer relies on.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.guardmap.testkit.contract.AbstractOrderedContainerContractTest}</li>
 *   <li>{@link com.ryuqq.guardmap.testkit.contract.AbstractLockPolicyContractTest}</li>
 * </ul>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
package com.ryuqq.guardmap.testkit.contract;
