/**
 * What a worker unit runs: the analysis and extraction
 * {@link com.auditsentinel.worker.scheduler.TaskHandler}s and the HTTP and
 * file collaborators they load audit data from and post alerts to.
 */
package com.auditsentinel.worker.pipeline;
