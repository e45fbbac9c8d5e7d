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

package com.aws.cdf;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.SQSBatchResponse;
import com.amazonaws.services.lambda.runtime.events.SQSEvent;
import com.aws.cdf.devices.DeviceTaskSqsWriter;
import com.aws.cdf.devices.DeviceTaskSummary;
import com.aws.cdf.devices.DevicesService;
import com.aws.cdf.di.DaggerProvisioningComponent;
import com.aws.cdf.di.ProvisioningComponent;
import com.aws.cdf.exceptions.ValidationException;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import java.util.ArrayList;
import java.util.List;

/**
 * Consumes the device association queue, running each queued task through the association workflow.
 * Only the messages whose task could not be persisted are reported back as batch item failures, so SQS
 * redelivers those alone.
 */
@Slf4j
public class DeviceAssociationQueueHandler implements RequestHandler<SQSEvent, SQSBatchResponse> {
	private static final ProvisioningComponent component;
	static {
		component = DaggerProvisioningComponent.builder().build();
	}

	@Inject @Setter
	public DevicesService devicesService;

	@Inject @Setter
	public Gson gson;

	public DeviceAssociationQueueHandler() {
		// As AWS Lambda manages the creation of this handler class and not Dagger, this technique registers
		// this object with Dagger which then allows it to inject its dependencies by Dagger.
		component.inject(this);
	}

	DeviceAssociationQueueHandler(DevicesService devicesService, Gson gson) {
		this.devicesService = devicesService;
		this.gson = gson;
	}

	@Override
	public SQSBatchResponse handleRequest(SQSEvent event, Context context) {
		log.debug("handleRequest> in> records:{}", event.getRecords() != null ? event.getRecords().size() : 0);

		List<SQSBatchResponse.BatchItemFailure> failures = new ArrayList<>();
		if (event.getRecords() == null) {
			return new SQSBatchResponse(failures);
		}

		for (var message : event.getRecords()) {
			var attributes = message.getMessageAttributes();
			var messageType = (attributes != null && attributes.get(DeviceTaskSqsWriter.MESSAGE_TYPE_ATTRIBUTE) != null)
				? attributes.get(DeviceTaskSqsWriter.MESSAGE_TYPE_ATTRIBUTE).getStringValue()
				: null;
			if (!DeviceTaskSummary.MESSAGE_TYPE.equals(messageType)) {
				log.warn("handleRequest> ignoring message {} of type {}", message.getMessageId(), messageType);
				continue;
			}

			DeviceTaskSummary taskInfo;
			try {
				taskInfo = gson.fromJson(message.getBody(), DeviceTaskSummary.class);
			} catch (JsonParseException e) {
				log.error("handleRequest> unreadable message " + message.getMessageId() + ", discarding", e);
				continue;
			}

			try {
				devicesService.associateDevicesWithGroup(taskInfo);
			} catch (ValidationException e) {
				// redelivery would never succeed
				log.error("handleRequest> invalid task in message " + message.getMessageId() + ", discarding", e);
			} catch (RuntimeException e) {
				log.error("handleRequest> failed processing message " + message.getMessageId() + ", returning it to the queue", e);
				failures.add(new SQSBatchResponse.BatchItemFailure(message.getMessageId()));
			}
		}

		log.debug("handleRequest> exit: failures:{}", failures.size());
		return new SQSBatchResponse(failures);
	}
}
