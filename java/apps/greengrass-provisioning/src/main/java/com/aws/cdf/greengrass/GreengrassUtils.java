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

package com.aws.cdf.greengrass;

import com.aws.cdf.exceptions.NotFoundException;
import com.aws.cdf.exceptions.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.services.greengrass.GreengrassAsyncClient;
import software.amazon.awssdk.services.greengrass.model.Core;
import software.amazon.awssdk.services.greengrass.model.CoreDefinitionVersion;
import software.amazon.awssdk.services.greengrass.model.CreateCoreDefinitionRequest;
import software.amazon.awssdk.services.greengrass.model.CreateCoreDefinitionVersionRequest;
import software.amazon.awssdk.services.greengrass.model.CreateDeviceDefinitionRequest;
import software.amazon.awssdk.services.greengrass.model.CreateDeviceDefinitionVersionRequest;
import software.amazon.awssdk.services.greengrass.model.CreateGroupVersionRequest;
import software.amazon.awssdk.services.greengrass.model.Device;
import software.amazon.awssdk.services.greengrass.model.DeviceDefinitionVersion;
import software.amazon.awssdk.services.greengrass.model.GetCoreDefinitionVersionRequest;
import software.amazon.awssdk.services.greengrass.model.GetDeviceDefinitionVersionRequest;
import software.amazon.awssdk.services.greengrass.model.GetGroupRequest;
import software.amazon.awssdk.services.greengrass.model.GetGroupVersionRequest;

import javax.inject.Inject;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Accessors for the Greengrass (v1) control plane. No retries are performed here, retry policy belongs to
 * the caller or to queue redelivery.
 */
@Slf4j
public class GreengrassUtils {

	private final GreengrassAsyncClient greengrass;

	@Inject
	public GreengrassUtils(GreengrassAsyncClient greengrass) {
		this.greengrass = greengrass;
	}

	public GreengrassGroup getGroupInfo(String groupId) {
		log.debug("getGroupInfo> in> groupId:{}", groupId);

		Validate.notEmpty(groupId, "groupId is required.");

		var request = GetGroupRequest.builder().groupId(groupId).build();
		var response = join(greengrass.getGroup(request), String.format("group '%s'", groupId));

		var result = GreengrassGroup.builder()
			.id(response.id())
			.name(response.name())
			.arn(response.arn())
			.latestVersion(response.latestVersion())
			.latestVersionArn(response.latestVersionArn())
			.build();

		log.debug("getGroupInfo> exit:{}", result);
		return result;
	}

	public GreengrassGroupVersion getGroupVersionInfo(String groupId, String versionId) {
		log.debug("getGroupVersionInfo> in> groupId:{}, versionId:{}", groupId, versionId);

		Validate.notEmpty(groupId, "groupId is required.");
		Validate.notEmpty(versionId, "versionId is required.");

		var request = GetGroupVersionRequest.builder().groupId(groupId).groupVersionId(versionId).build();
		var response = join(greengrass.getGroupVersion(request),
			String.format("group '%s' version '%s'", groupId, versionId));

		var builder = GreengrassGroupVersion.builder()
			.groupId(response.id())
			.versionId(response.version())
			.arn(response.arn());
		var definition = response.definition();
		if (definition != null) {
			builder.coreDefinitionVersionArn(definition.coreDefinitionVersionArn())
				.deviceDefinitionVersionArn(definition.deviceDefinitionVersionArn())
				.functionDefinitionVersionArn(definition.functionDefinitionVersionArn())
				.loggerDefinitionVersionArn(definition.loggerDefinitionVersionArn())
				.resourceDefinitionVersionArn(definition.resourceDefinitionVersionArn())
				.subscriptionDefinitionVersionArn(definition.subscriptionDefinitionVersionArn())
				.connectorDefinitionVersionArn(definition.connectorDefinitionVersionArn());
		}
		var result = builder.build();

		log.debug("getGroupVersionInfo> exit:{}", result);
		return result;
	}

	public DefinitionVersion getCoreInfo(String coreDefinitionVersionArn) {
		log.debug("getCoreInfo> in> coreDefinitionVersionArn:{}", coreDefinitionVersionArn);

		if (coreDefinitionVersionArn == null) {
			log.debug("getCoreInfo> exit: no core definition");
			return DefinitionVersion.empty();
		}

		var arn = DefinitionVersionArn.parse(coreDefinitionVersionArn);
		var request = GetCoreDefinitionVersionRequest.builder()
			.coreDefinitionId(arn.getDefinitionId())
			.coreDefinitionVersionId(arn.getVersionId())
			.build();
		var response = join(greengrass.getCoreDefinitionVersion(request),
			String.format("core definition version '%s'", coreDefinitionVersionArn));

		List<DefinitionMember> members = List.of();
		if (response.definition() != null && response.definition().hasCores()) {
			members = response.definition().cores().stream()
				.map(c -> DefinitionMember.builder()
					.id(c.id())
					.thingArn(c.thingArn())
					.certificateArn(c.certificateArn())
					.syncShadow(c.syncShadow())
					.build())
				.collect(Collectors.toList());
		}

		var result = DefinitionVersion.builder()
			.arn(response.arn())
			.definitionId(response.id())
			.versionId(response.version())
			.members(members)
			.build();

		log.debug("getCoreInfo> exit:{}", result);
		return result;
	}

	public DefinitionVersion getDeviceInfo(String deviceDefinitionVersionArn) {
		log.debug("getDeviceInfo> in> deviceDefinitionVersionArn:{}", deviceDefinitionVersionArn);

		if (deviceDefinitionVersionArn == null) {
			log.debug("getDeviceInfo> exit: no device definition");
			return DefinitionVersion.empty();
		}

		var arn = DefinitionVersionArn.parse(deviceDefinitionVersionArn);
		var request = GetDeviceDefinitionVersionRequest.builder()
			.deviceDefinitionId(arn.getDefinitionId())
			.deviceDefinitionVersionId(arn.getVersionId())
			.build();
		var response = join(greengrass.getDeviceDefinitionVersion(request),
			String.format("device definition version '%s'", deviceDefinitionVersionArn));

		List<DefinitionMember> members = List.of();
		if (response.definition() != null && response.definition().hasDevices()) {
			members = response.definition().devices().stream()
				.map(d -> DefinitionMember.builder()
					.id(d.id())
					.thingArn(d.thingArn())
					.certificateArn(d.certificateArn())
					.syncShadow(d.syncShadow())
					.build())
				.collect(Collectors.toList());
		}

		var result = DefinitionVersion.builder()
			.arn(response.arn())
			.definitionId(response.id())
			.versionId(response.version())
			.members(members)
			.build();

		log.debug("getDeviceInfo> exit:{}", result);
		return result;
	}

	/**
	 * Creates a new version of the core definition. If the group has no core definition yet, a new
	 * definition is created with the cores as its initial version.
	 */
	public DefinitionVersion createCoreDefinitionVersion(String coreDefinitionId, String name, List<DefinitionMember> members) {
		log.debug("createCoreDefinitionVersion> in> coreDefinitionId:{}, name:{}, members:{}", coreDefinitionId, name, members);

		var cores = members.stream()
			.map(m -> Core.builder()
				.id(m.getId())
				.thingArn(m.getThingArn())
				.certificateArn(m.getCertificateArn())
				.syncShadow(m.getSyncShadow())
				.build())
			.collect(Collectors.toList());

		DefinitionVersion result;
		if (coreDefinitionId == null) {
			var request = CreateCoreDefinitionRequest.builder()
				.name(name)
				.initialVersion(CoreDefinitionVersion.builder().cores(cores).build())
				.build();
			var response = join(greengrass.createCoreDefinition(request), String.format("core definition '%s'", name));
			result = DefinitionVersion.builder()
				.arn(response.latestVersionArn())
				.definitionId(response.id())
				.versionId(response.latestVersion())
				.members(members)
				.build();
		} else {
			var request = CreateCoreDefinitionVersionRequest.builder()
				.coreDefinitionId(coreDefinitionId)
				.cores(cores)
				.build();
			var response = join(greengrass.createCoreDefinitionVersion(request),
				String.format("core definition '%s'", coreDefinitionId));
			result = DefinitionVersion.builder()
				.arn(response.arn())
				.definitionId(response.id())
				.versionId(response.version())
				.members(members)
				.build();
		}

		log.debug("createCoreDefinitionVersion> exit:{}", result);
		return result;
	}

	/**
	 * Creates a new version of the device definition. If the group has no device definition yet, a new
	 * definition is created with the devices as its initial version.
	 */
	public DefinitionVersion createDeviceDefinitionVersion(String deviceDefinitionId, String name, List<DefinitionMember> members) {
		log.debug("createDeviceDefinitionVersion> in> deviceDefinitionId:{}, name:{}, members:{}", deviceDefinitionId, name, members);

		var devices = members.stream()
			.map(m -> Device.builder()
				.id(m.getId())
				.thingArn(m.getThingArn())
				.certificateArn(m.getCertificateArn())
				.syncShadow(m.getSyncShadow())
				.build())
			.collect(Collectors.toList());

		DefinitionVersion result;
		if (deviceDefinitionId == null) {
			var request = CreateDeviceDefinitionRequest.builder()
				.name(name)
				.initialVersion(DeviceDefinitionVersion.builder().devices(devices).build())
				.build();
			var response = join(greengrass.createDeviceDefinition(request), String.format("device definition '%s'", name));
			result = DefinitionVersion.builder()
				.arn(response.latestVersionArn())
				.definitionId(response.id())
				.versionId(response.latestVersion())
				.members(members)
				.build();
		} else {
			var request = CreateDeviceDefinitionVersionRequest.builder()
				.deviceDefinitionId(deviceDefinitionId)
				.devices(devices)
				.build();
			var response = join(greengrass.createDeviceDefinitionVersion(request),
				String.format("device definition '%s'", deviceDefinitionId));
			result = DefinitionVersion.builder()
				.arn(response.arn())
				.definitionId(response.id())
				.versionId(response.version())
				.members(members)
				.build();
		}

		log.debug("createDeviceDefinitionVersion> exit:{}", result);
		return result;
	}

	public GreengrassGroupVersion createGroupVersion(String groupId, GreengrassGroupVersion version) {
		log.debug("createGroupVersion> in> groupId:{}, version:{}", groupId, version);

		Validate.notEmpty(groupId, "groupId is required.");

		var request = CreateGroupVersionRequest.builder()
			.groupId(groupId)
			.coreDefinitionVersionArn(version.getCoreDefinitionVersionArn())
			.deviceDefinitionVersionArn(version.getDeviceDefinitionVersionArn())
			.functionDefinitionVersionArn(version.getFunctionDefinitionVersionArn())
			.loggerDefinitionVersionArn(version.getLoggerDefinitionVersionArn())
			.resourceDefinitionVersionArn(version.getResourceDefinitionVersionArn())
			.subscriptionDefinitionVersionArn(version.getSubscriptionDefinitionVersionArn())
			.connectorDefinitionVersionArn(version.getConnectorDefinitionVersionArn())
			.build();
		var response = join(greengrass.createGroupVersion(request), String.format("group '%s'", groupId));

		var result = version.toBuilder()
			.groupId(response.id())
			.versionId(response.version())
			.arn(response.arn())
			.build();

		log.debug("createGroupVersion> exit:{}", result);
		return result;
	}

	private <T> T join(CompletableFuture<T> future, String resource) {
		try {
			return future.join();
		} catch (CompletionException e) {
			var cause = e.getCause();
			if (cause instanceof SdkServiceException) {
				var statusCode = ((SdkServiceException) cause).statusCode();
				if (statusCode == 404) {
					throw new NotFoundException(String.format("Greengrass %s not found.", resource), cause);
				}
				throw new UpstreamException(String.format("Greengrass call for %s failed: %s", resource, cause.getMessage()), statusCode, cause);
			}
			log.error("join> " + e.getMessage(), e);
			throw new UpstreamException(String.format("Greengrass call for %s failed: %s", resource,
				cause != null ? cause.getMessage() : e.getMessage()), e);
		}
	}
}
