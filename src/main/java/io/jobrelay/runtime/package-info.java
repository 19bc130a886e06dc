/**
 * Runtime orchestration package.
 *
 * <p>{@link io.jobrelay.runtime.JobScheduler} covers staging, promotion, stop, removal and
 * listing; {@link io.jobrelay.runtime.JobWorker} executes a claimed job and always finalizes it.
 */
package io.jobrelay.runtime;
