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

import com.aws.cdf.devices.DeviceItem;
import com.aws.cdf.greengrass.DefinitionMember;
import com.aws.cdf.greengrass.GreengrassUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Publishes a new group version referencing new core and device definition versions that include the devices
 * being associated. All other definitions of the current group version are carried over unchanged.
 */
@Slf4j
public class CreateGroupVersionHandler extends AbstractDeviceAssociationHandler {

	private final GreengrassUtils greengrassUtils;

	public CreateGroupVersionHandler(GreengrassUtils greengrassUtils) {
		this.greengrassUtils = greengrassUtils;
	}

	@Override
	public HandlerResult handle(AssociationRequest request) {
		log.debug("handle> in> taskId:{}", request.getTaskInfo().getTaskId());

		var active = request.activeDevices();
		if (active.isEmpty()) {
			return failTask(request, "No devices remaining to associate.");
		}

		var group = request.getGroup();
		var newVersion = request.getGgGroupVersion().toBuilder();

		var cores = active.stream().filter(DeviceItem::isCore).collect(Collectors.toList());
		if (!cores.isEmpty()) {
			// a group has a single core, so the requested core replaces whatever was there
			var coreVersion = greengrassUtils.createCoreDefinitionVersion(request.getGgCoreVersion().getDefinitionId(),
				String.format("%s-cores", group.getName()), List.of(toMember(request, cores.get(0))));
			newVersion.coreDefinitionVersionArn(coreVersion.getArn());
		}

		var devices = active.stream().filter(d -> !d.isCore()).collect(Collectors.toList());
		if (!devices.isEmpty()) {
			var members = new ArrayList<>(request.getGgDeviceVersion().getMembers());
			for (var device : devices) {
				var member = toMember(request, device);
				var alreadyMember = members.stream().anyMatch(m -> member.getThingArn().equals(m.getThingArn()));
				if (!alreadyMember) {
					members.add(member);
				}
			}
			var deviceVersion = greengrassUtils.createDeviceDefinitionVersion(request.getGgDeviceVersion().getDefinitionId(),
				String.format("%s-devices", group.getName()), members);
			newVersion.deviceDefinitionVersionArn(deviceVersion.getArn());
		}

		var created = greengrassUtils.createGroupVersion(request.getGgGroup().getId(), newVersion.build());
		request.setNewGroupVersion(created);

		group.setVersionId(created.getVersionId());
		group.setVersionNo(group.getVersionNo() == null ? 1 : group.getVersionNo() + 1);

		log.debug("handle> exit: newGroupVersion:{}", created);
		return HandlerResult.CONTINUE;
	}

	private DefinitionMember toMember(AssociationRequest request, DeviceItem device) {
		var thingName = device.getThingName();
		return DefinitionMember.builder()
			.id(thingName)
			.thingArn(request.getThings().get(thingName).getThingArn())
			.certificateArn(request.getCertificateArns().get(thingName))
			.syncShadow(Boolean.TRUE.equals(device.getSyncShadow()))
			.build();
	}
}
