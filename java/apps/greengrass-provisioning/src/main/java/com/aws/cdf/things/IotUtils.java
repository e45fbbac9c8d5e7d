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

package com.aws.cdf.things;

import com.aws.cdf.exceptions.NotFoundException;
import com.aws.cdf.exceptions.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.services.iot.IotAsyncClient;
import software.amazon.awssdk.services.iot.model.DescribeProvisioningTemplateRequest;
import software.amazon.awssdk.services.iot.model.DescribeThingRequest;
import software.amazon.awssdk.services.iot.model.ListThingPrincipalsRequest;
import software.amazon.awssdk.services.iot.model.RegisterThingRequest;
import software.amazon.awssdk.services.iot.model.ResourceNotFoundException;

import javax.inject.Inject;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@Slf4j
public class IotUtils {

	/**
	 * parameter every provisioning template receives, set to the name of the thing being provisioned
	 */
	public static final String THING_NAME_PARAMETER = "ThingName";

	private final IotAsyncClient iot;

	@Inject
	public IotUtils(IotAsyncClient iot) {
		this.iot = iot;
	}

	/**
	 * @return the thing, or empty if no thing of that name is registered
	 */
	public Optional<ThingInfo> describeThing(String thingName) {
		log.debug("describeThing> in> thingName:{}", thingName);

		Validate.notEmpty(thingName, "thingName is required.");

		var request = DescribeThingRequest.builder().thingName(thingName).build();
		try {
			var response = iot.describeThing(request).join();
			var result = ThingInfo.builder()
				.thingName(response.thingName())
				.thingArn(response.thingArn())
				.thingTypeName(response.thingTypeName())
				.attributes(response.attributes())
				.build();
			log.debug("describeThing> exit:{}", result);
			return Optional.of(result);
		} catch (CompletionException e) {
			if (e.getCause() instanceof ResourceNotFoundException) {
				log.debug("describeThing> exit: thing {} not found", thingName);
				return Optional.empty();
			}
			throw upstream(e, String.format("describing thing '%s'", thingName));
		}
	}

	public List<String> listThingPrincipals(String thingName) {
		log.debug("listThingPrincipals> in> thingName:{}", thingName);

		Validate.notEmpty(thingName, "thingName is required.");

		var request = ListThingPrincipalsRequest.builder().thingName(thingName).build();
		var response = join(iot.listThingPrincipals(request), String.format("listing principals of thing '%s'", thingName));

		var result = response.hasPrincipals() ? response.principals() : List.<String>of();
		log.debug("listThingPrincipals> exit:{}", result);
		return result;
	}

	/**
	 * Registers a thing using the body of the named IoT provisioning template.
	 *
	 * @return the arns of the resources created, keyed by resource type
	 */
	public Map<String, String> provisionThing(String thingName, String templateName, Map<String, String> parameters) {
		log.debug("provisionThing> in> thingName:{}, templateName:{}, parameters:{}", thingName, templateName, parameters);

		Validate.notEmpty(thingName, "thingName is required.");
		Validate.notEmpty(templateName, "templateName is required.");

		var templateRequest = DescribeProvisioningTemplateRequest.builder().templateName(templateName).build();
		var template = join(iot.describeProvisioningTemplate(templateRequest),
			String.format("describing provisioning template '%s'", templateName));

		var templateParameters = new HashMap<String, String>();
		if (parameters != null) {
			templateParameters.putAll(parameters);
		}
		templateParameters.put(THING_NAME_PARAMETER, thingName);

		var registerRequest = RegisterThingRequest.builder()
			.templateBody(template.templateBody())
			.parameters(templateParameters)
			.build();
		var response = join(iot.registerThing(registerRequest), String.format("registering thing '%s'", thingName));

		var result = response.hasResourceArns() ? response.resourceArns() : Map.<String, String>of();
		log.debug("provisionThing> exit:{}", result);
		return result;
	}

	private <T> T join(CompletableFuture<T> future, String operation) {
		try {
			return future.join();
		} catch (CompletionException e) {
			if (e.getCause() instanceof ResourceNotFoundException) {
				throw new NotFoundException(String.format("Failed %s: %s", operation, e.getCause().getMessage()), e.getCause());
			}
			throw upstream(e, operation);
		}
	}

	private UpstreamException upstream(CompletionException e, String operation) {
		var cause = e.getCause() != null ? e.getCause() : e;
		var statusCode = cause instanceof SdkServiceException ? ((SdkServiceException) cause).statusCode() : -1;
		log.error(String.format("upstream> failed %s", operation), cause);
		return new UpstreamException(String.format("Failed %s: %s", operation, cause.getMessage()), statusCode, cause);
	}
}
