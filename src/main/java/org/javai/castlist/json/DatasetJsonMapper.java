package org.javai.castlist.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.castlist.CastListException;
import org.javai.castlist.model.CastMember;
import org.javai.castlist.model.CastMemberVisitor;
import org.javai.castlist.model.Dataset;
import org.javai.castlist.model.Fragment;
import org.javai.castlist.model.FragmentVisitor;
import org.javai.castlist.model.ParseIssue;

/**
 * Utility to convert a {@link Dataset} into JSON for diagnostics and tooling.
 *
 * <p>Characters and fragments carry a {@code kind} discriminator ({@code node}, {@code raw},
 * {@code info}, {@code alias}, {@code group}). Group members are written in full, so a
 * member node appears both nested in its group and in {@code entries}.</p>
 */
public final class DatasetJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper();

	private DatasetJsonMapper() {
	}

	public static ObjectNode toJson(Dataset dataset) {
		ObjectNode node = mapper.createObjectNode();
		ArrayNode entries = node.putArray("entries");
		for (CastMember.Node entry : dataset.entries()) {
			entries.add(toJson(entry));
		}
		ArrayNode issues = node.putArray("issuesDetailed");
		for (ParseIssue issue : dataset.issuesDetailed()) {
			issues.add(toJson(issue));
		}
		return node;
	}

	public static ObjectNode toJson(CastMember member) {
		return member.accept(MEMBER_WRITER);
	}

	public static ObjectNode toJson(Fragment fragment) {
		return fragment.accept(FRAGMENT_WRITER);
	}

	public static ObjectNode toJson(ParseIssue issue) {
		ObjectNode node = mapper.createObjectNode();
		node.put("code", issue.code().name());
		node.put("raw", issue.raw());
		if (issue.path() != null) {
			node.put("path", issue.path());
		}
		if (issue.message() != null) {
			node.put("message", issue.message());
		}
		return node;
	}

	public static String toPrettyString(Dataset dataset) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(dataset));
		} catch (JsonProcessingException e) {
			throw new CastListException("Failed to write dataset as JSON", e);
		}
	}

	private static final CastMemberVisitor<ObjectNode> MEMBER_WRITER = new CastMemberVisitor<>() {

		@Override
		public ObjectNode visitNode(CastMember.Node member) {
			ObjectNode node = mapper.createObjectNode();
			node.put("kind", "node");
			node.put("name", member.name());
			ArrayNode fragments = node.putArray("fragments");
			for (Fragment fragment : member.fragments()) {
				fragments.add(toJson(fragment));
			}
			return node;
		}

		@Override
		public ObjectNode visitRaw(CastMember.Raw member) {
			ObjectNode node = mapper.createObjectNode();
			node.put("kind", "raw");
			node.put("raw", member.raw());
			return node;
		}
	};

	private static final FragmentVisitor<ObjectNode> FRAGMENT_WRITER = new FragmentVisitor<>() {

		@Override
		public ObjectNode visitInfo(Fragment.Info info) {
			return simple("info", info.raw());
		}

		@Override
		public ObjectNode visitAlias(Fragment.Alias alias) {
			return simple("alias", alias.raw());
		}

		@Override
		public ObjectNode visitGroup(Fragment.Group group) {
			ObjectNode node = simple("group", group.raw());
			ArrayNode members = node.putArray("members");
			for (CastMember member : group.members()) {
				members.add(toJson(member));
			}
			return node;
		}

		private ObjectNode simple(String kind, String raw) {
			ObjectNode node = mapper.createObjectNode();
			node.put("kind", kind);
			node.put("raw", raw);
			return node;
		}
	};
}
