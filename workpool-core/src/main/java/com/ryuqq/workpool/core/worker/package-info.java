/**
 * Worker Invocation 계약.
 *
 * <p>{@link com.ryuqq.workpool.core.worker.WorkerFunction}은 Supervisor가 Work 하나마다 실행하는 호출자 로직입니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.workpool.core.worker;
