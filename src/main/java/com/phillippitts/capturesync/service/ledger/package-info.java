/**
 * Segment ledger access and working-directory preparation.
 *
 * <p>The recorder appends one file name per closed segment to {@code segment_list.txt} in each
 * track directory. These classes are leaf dependencies with no concurrency of their own.
 */
package com.phillippitts.capturesync.service.ledger;
