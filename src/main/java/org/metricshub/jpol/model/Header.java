package org.metricshub.jpol.model;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jpol
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The <code>header { ... }</code> block of a filter: the targets it is
 * generated for, free text comments, and the configuration groups the
 * generated filter applies.
 */
public class Header {

	private final List<Target> targets = new ArrayList<Target>();
	private final List<String> comments = new ArrayList<String>();
	private final List<String> applyGroups = new ArrayList<String>();
	private final List<String> applyGroupsExcept = new ArrayList<String>();

	/**
	 * @param target a target line
	 */
	public void addObject(Target target) {
		targets.add(target);
	}

	/**
	 * @param value a <code>COMMENT</code> value
	 * @throws TermObjectTypeException for any other kind
	 */
	public void addObject(VarType value) {
		switch (value.getKind()) {
		case COMMENT:
			comments.add(value.getString());
			break;
		case APPLY_GROUPS:
			applyGroups.add(value.getString());
			break;
		case APPLY_GROUPS_EXCEPT:
			applyGroupsExcept.add(value.getString());
			break;
		default:
			throw new TermObjectTypeException(value.getKind() + " (" + value + ") is not a header attribute");
		}
	}

	/**
	 * @param values values of one attribute line
	 * @throws TermObjectTypeException if a value is not a header attribute
	 */
	public void addObject(List<VarType> values) {
		for (VarType value : values) {
			addObject(value);
		}
	}

	/**
	 * @return the targets, unmodifiable
	 */
	public List<Target> getTargets() {
		return Collections.unmodifiableList(targets);
	}

	/**
	 * @return the comments, unmodifiable
	 */
	public List<String> getComments() {
		return Collections.unmodifiableList(comments);
	}

	/**
	 * @return the apply-groups, unmodifiable
	 */
	public List<String> getApplyGroups() {
		return Collections.unmodifiableList(applyGroups);
	}

	/**
	 * @return the apply-groups-except, unmodifiable
	 */
	public List<String> getApplyGroupsExcept() {
		return Collections.unmodifiableList(applyGroupsExcept);
	}

	/**
	 * @return the platform of every target, in order
	 */
	public List<String> getPlatforms() {
		List<String> platforms = new ArrayList<String>();
		for (Target target : targets) {
			platforms.add(target.getPlatform());
		}
		return platforms;
	}

	/**
	 * @param platform a platform identifier
	 * @return the options of the first target for <code>platform</code>, empty if there is none
	 */
	public List<String> getFilterOptions(String platform) {
		for (Target target : targets) {
			if (target.getPlatform().equals(platform)) {
				return target.getOptions();
			}
		}
		return Collections.emptyList();
	}

	/**
	 * Name of the filter generated for a platform: its first option.
	 * Zone based platforms (<code>srx</code>, <code>paloalto</code>) name the
	 * filter after the zone pair, <code>from-zone&gt;to-zone</code>, taken from
	 * options such as <code>from-zone trust to-zone untrust</code>.
	 *
	 * @param platform a platform identifier
	 * @return the filter name, or <code>null</code> when the target has no option
	 */
	public String getFilterName(String platform) {
		List<String> options = getFilterOptions(platform);
		if (("srx".equals(platform) || "paloalto".equals(platform)) && options.size() >= 4) {
			return options.get(1) + ">" + options.get(3);
		}
		return options.isEmpty() ? null : options.get(0);
	}

	/** {@inheritDoc} */
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Header)) {
			return false;
		}
		Header other = (Header) obj;
		return targets.equals(other.targets)
				&& comments.equals(other.comments)
				&& applyGroups.equals(other.applyGroups)
				&& applyGroupsExcept.equals(other.applyGroupsExcept);
	}

	/** {@inheritDoc} */
	@Override
	public int hashCode() {
		return targets.hashCode();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return "header: targets=" + targets + " comments=" + comments;
	}
}
