/*
 *  Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License"). You may not use this file except in compliance
 *  with the License. A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  or in the 'license' file accompanying this file. This file is distributed on an 'AS IS' BASIS, WITHOUT WARRANTIES
 *  OR CONDITIONS OF ANY KIND, express or implied. See the License for the specific language governing permissions
 *  and limitations under the License.
 */

package com.aws.cdf.devices;

import com.aws.cdf.exceptions.RecordCouldNotBeSentException;
import com.aws.cdf.exceptions.UpstreamException;
import com.google.gson.Gson;
import com.typesafe.config.Config;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.RandomUtils;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SqsException;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Publishes device association tasks to the queue consumed by {@link com.aws.cdf.DeviceAssociationQueueHandler}.
 */
@Slf4j
@ThreadSafe
public class DeviceTaskSqsWriter {

	public static final String MESSAGE_TYPE_ATTRIBUTE = "messageType";

	/**
	 * config...
	 */
	private final int sqsNumberOfRetries;
	private final long sqsMaxBackOffInMillis;
	private final long sqsBaseBackOffInMillis;
	private final String sqsQueueUrl;

	private final SqsAsyncClient sqsClient;
	private final Gson gson;

	public DeviceTaskSqsWriter(SqsAsyncClient sqsClient, Config config, Gson gson) {
		log.debug("in>");
		this.sqsClient = sqsClient;
		this.gson = gson;

		sqsNumberOfRetries = config.getInt("provisioning.aws.sqs.deviceAssociations.numberOfRetries");
		sqsMaxBackOffInMillis = config.getLong("provisioning.aws.sqs.deviceAssociations.maxBackOffInMillis");
		sqsBaseBackOffInMillis = config.getLong("provisioning.aws.sqs.deviceAssociations.baseBackOffInMillis");
		sqsQueueUrl = config.getString("provisioning.aws.sqs.deviceAssociations.queueUrl");
	}

	public void submitWithRetry(DeviceTaskSummary taskInfo) throws RecordCouldNotBeSentException {
		log.debug("submitWithRetry> in> taskId:{}", taskInfo.getTaskId());

		var sendMessageReq = SendMessageRequest.builder()
			.queueUrl(sqsQueueUrl)
			.messageBody(gson.toJson(taskInfo))
			.messageAttributes(Map.of(MESSAGE_TYPE_ATTRIBUTE, MessageAttributeValue.builder()
				.dataType("String")
				.stringValue(DeviceTaskSummary.MESSAGE_TYPE)
				.build()))
			.build();

		String warnMessage = null;
		for (int attempts = 0; attempts < sqsNumberOfRetries; attempts++) {
			try {
				log.debug("Sending: {}", sendMessageReq);
				sqsClient.sendMessage(sendMessageReq).join();
				log.debug("submitWithRetry> exit: message sent");
				return;
			} catch (CompletionException e) {
				var ex = e.getCause() instanceof SqsException ? (SqsException) e.getCause() : null;
				// SQS will return 503 to indicate client to slow down
				if (ex != null && ex.statusCode() == 503) {
					warnMessage = ex.getMessage();
					log.warn(warnMessage);
					// Full Jitter:
					// https://aws.amazon.com/blogs/architecture/exponential-backoff-and-jitter/
					long timeToSleep = RandomUtils.nextLong(0, Math.min(sqsMaxBackOffInMillis, (sqsBaseBackOffInMillis * 2 * attempts)));
					log.debug("Sleeping for: {}ms on attempt: {}", timeToSleep, attempts);
					try {
						Thread.sleep(timeToSleep);
					} catch (InterruptedException ie) {
						log.error("An interrupted exception has been thrown between retry attempts.", ie);
						Thread.currentThread().interrupt();
						throw new RecordCouldNotBeSentException("Interrupted between retry attempts. " + warnMessage);
					}
				} else {
					var cause = e.getCause() != null ? e.getCause() : e;
					log.error("An exception has been thrown.", cause);
					throw new UpstreamException(String.format("Failed publishing task %s: %s", taskInfo.getTaskId(), cause.getMessage()),
						ex != null ? ex.statusCode() : -1, cause);
				}
			}
		}

		throw new RecordCouldNotBeSentException("Exceeded number of attempts! " + warnMessage);
	}
}
