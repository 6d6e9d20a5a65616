package org.javai.castlist.json;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.castlist.CastList;
import org.javai.castlist.model.Dataset;
import org.javai.castlist.model.IssueCode;
import org.javai.castlist.model.ParseIssue;
import org.junit.jupiter.api.Test;

class DatasetJsonMapperTest {

	@Test
	void writesEntriesWithKindDiscriminators() {
		Dataset dataset = CastList.parse("Justice League [Wonder Woman; Batman [Bruce Wayne]] (founded 1960);");

		ObjectNode json = DatasetJsonMapper.toJson(dataset);

		assertThat(json.get("entries").size()).isEqualTo(3);
		JsonNode league = json.get("entries").get(0);
		assertThat(league.get("kind").asText()).isEqualTo("node");
		assertThat(league.get("name").asText()).isEqualTo("Justice League");

		JsonNode group = league.get("fragments").get(0);
		assertThat(group.get("kind").asText()).isEqualTo("group");
		assertThat(group.get("raw").asText()).isEqualTo("Wonder Woman; Batman [Bruce Wayne]");
		assertThat(group.get("members").size()).isEqualTo(2);
		assertThat(group.get("members").get(1).get("fragments").get(0).get("kind").asText()).isEqualTo("alias");

		JsonNode info = league.get("fragments").get(1);
		assertThat(info.get("kind").asText()).isEqualTo("info");
		assertThat(info.get("raw").asText()).isEqualTo("founded 1960");
	}

	@Test
	void writesRawMembers() {
		Dataset dataset = CastList.parse("Team [[Ghost]; Bob [b]]");

		JsonNode members = DatasetJsonMapper.toJson(dataset)
				.get("entries").get(0)
				.get("fragments").get(0)
				.get("members");

		assertThat(members.get(0).get("kind").asText()).isEqualTo("raw");
		assertThat(members.get(0).get("raw").asText()).isEqualTo("[Ghost]");
		assertThat(members.get(0).has("name")).isFalse();
	}

	@Test
	void writesIssuesAndOmitsMissingFields() {
		ObjectNode withPath = DatasetJsonMapper.toJson(
				new ParseIssue(IssueCode.MISSING_NAME, "[Solo]", "top[0]", "no name"));
		ObjectNode bare = DatasetJsonMapper.toJson(ParseIssue.of(IssueCode.UNMATCHED_ROUND, "(x"));

		assertThat(withPath.get("code").asText()).isEqualTo("MISSING_NAME");
		assertThat(withPath.get("path").asText()).isEqualTo("top[0]");
		assertThat(withPath.get("message").asText()).isEqualTo("no name");
		assertThat(bare.has("path")).isFalse();
		assertThat(bare.has("message")).isFalse();
	}

	@Test
	void prettyStringIsValidJson() throws Exception {
		Dataset dataset = CastList.parse("Superman [Clark Kent; Kal-El];");

		String text = DatasetJsonMapper.toPrettyString(dataset);
		JsonNode reread = new ObjectMapper().readTree(text);

		assertThat(reread.get("entries").get(0).get("name").asText()).isEqualTo("Superman");
		assertThat(reread.get("issuesDetailed").get(0).get("code").asText()).isEqualTo("AMBIGUOUS_SQUARE_LIST");
		assertThat(text).contains("\n");
	}
}
