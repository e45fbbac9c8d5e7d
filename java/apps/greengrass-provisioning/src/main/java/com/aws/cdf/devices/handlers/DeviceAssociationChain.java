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

package com.aws.cdf.devices.handlers;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Runs the device association steps in order over a shared {@link AssociationRequest}, stopping early if a
 * step fails the whole task. The terminal {@link SaveGroupHandler} runs once at the end either way.
 */
@Slf4j
public class DeviceAssociationChain {

	private final List<DeviceAssociationHandler> handlers;
	private final SaveGroupHandler saveGroupHandler;

	public DeviceAssociationChain(List<DeviceAssociationHandler> handlers, SaveGroupHandler saveGroupHandler) {
		this.handlers = List.copyOf(handlers);
		this.saveGroupHandler = saveGroupHandler;
	}

	public void execute(AssociationRequest request) {
		log.debug("execute> in> taskId:{}", request.getTaskInfo().getTaskId());

		for (var handler : handlers) {
			log.debug("execute> running {}", handler.name());
			if (handler.handle(request) == HandlerResult.HALT) {
				log.info("execute> {} halted task {}: {}", handler.name(), request.getTaskInfo().getTaskId(),
					request.getGroup().getStatusMessage());
				break;
			}
		}

		saveGroupHandler.handle(request);

		log.debug("execute> exit:");
	}

	/**
	 * Runs only the terminal step, for when the chain was aborted by an unexpected error.
	 */
	public void persist(AssociationRequest request) {
		log.debug("persist> in> taskId:{}", request.getTaskInfo().getTaskId());
		saveGroupHandler.handle(request);
		log.debug("persist> exit:");
	}

	public List<DeviceAssociationHandler> getHandlers() {
		return handlers;
	}
}
