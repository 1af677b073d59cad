package com.eainde.atlas.tools.builtin;

import com.eainde.atlas.tools.AbstractToolCapability;
import com.eainde.atlas.tools.FieldType;
import com.eainde.atlas.tools.SourceAttribution;
import com.eainde.atlas.tools.ToolResult;
import com.eainde.atlas.tools.ToolSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Passage search over a small travel knowledge base. Every returned passage is credited as
 * a source, so this is the capability that puts guide material into a plan's citations.
 * <p>
 * Scoring is term overlap: the share of query terms that occur in the passage.
 */
@Slf4j
@Component
public class KnowledgeBaseTool extends AbstractToolCapability {

    public static final String NAME = "knowledge_base";

    static final int MAX_LIMIT = 20;
    private static final int SNIPPET_LENGTH = 160;
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "what", "are", "how", "from", "into", "about", "best", "trip", "travel");

    private static final List<Passage> PASSAGES = List.of(
            new Passage("Lisbon City Guide", "guide", 0,
                    "Lisbon trams: line 28 climbs from Martim Moniz through Alfama to Estrela. "
                            + "A 24-hour Carris pass costs about 6.80 EUR and covers trams, buses and elevators."),
            new Passage("Lisbon City Guide", "guide", 1,
                    "Belem is west of central Lisbon. The Jeronimos Monastery opens 09:30 to 18:00, "
                            + "closed Mondays; tickets are 12 EUR. Pasteis de Belem sells custard tarts nearby."),
            new Passage("Sintra Day Trips", "guide", 0,
                    "Trains from Lisbon Rossio reach Sintra in 40 minutes, every 20 minutes. "
                            + "Pena Palace tickets are 20 EUR and timed entry slots sell out in summer."),
            new Passage("Porto City Guide", "guide", 0,
                    "Porto port wine cellars line the Gaia riverside. Tastings start around 15 EUR; "
                            + "the Dom Luis I bridge connects Ribeira with Gaia on foot."),
            new Passage("Paris Museum Pass", "pricing", 0,
                    "The Paris Museum Pass covers the Louvre, Orsay and Versailles. "
                            + "Two days cost 62 EUR, four days 77 EUR; Louvre entry still needs a timed reservation."),
            new Passage("Tokyo Transit Basics", "guide", 0,
                    "Tokyo Suica cards work on JR and metro lines. The Tokyo Subway Ticket gives 24, 48 "
                            + "or 72 hours of unlimited metro rides for 800, 1200 or 1500 JPY."),
            new Passage("Seasonal Travel Notes", "advisory", 0,
                    "Southern Europe in July and August is hot and crowded; book Lisbon, Porto and Paris "
                            + "hotels early and plan museum visits for the morning."));

    public KnowledgeBaseTool() {
        super(NAME,
                "Search the travel knowledge base. Returns guide passages with pricing and schedules.",
                ToolSchema.builder()
                        .required("query", FieldType.STRING, "What to look up, e.g. 'Lisbon tram pass price'")
                        .optional("limit", FieldType.INTEGER, "Maximum passages to return (1-20)", 5)
                        .optional("similarity_threshold", FieldType.NUMBER,
                                "Minimum share of query terms a passage must contain (0-1)", 0.3)
                        .build());
    }

    @Override
    protected ToolResult invoke(Map<String, Object> arguments) {
        String query = stringArg(arguments, "query");
        int limit = intArg(arguments, "limit");
        double threshold = ((Number) arguments.get("similarity_threshold")).doubleValue();
        if (limit < 1 || limit > MAX_LIMIT) {
            return ToolResult.failure("limit must be between 1 and " + MAX_LIMIT);
        }
        if (threshold < 0 || threshold > 1) {
            return ToolResult.failure("similarity_threshold must be between 0 and 1");
        }

        Set<String> queryTerms = terms(query);
        if (queryTerms.isEmpty()) {
            return ToolResult.failure("query has no searchable terms");
        }

        List<Match> matches = new ArrayList<>();
        for (Passage passage : PASSAGES) {
            Set<String> passageTerms = terms(passage.title() + " " + passage.text());
            long hits = queryTerms.stream().filter(passageTerms::contains).count();
            double similarity = (double) hits / queryTerms.size();
            if (hits > 0 && similarity >= threshold) {
                matches.add(new Match(passage, similarity));
            }
        }
        matches.sort(Comparator.comparingDouble(Match::similarity).reversed());
        List<Match> top = matches.subList(0, Math.min(limit, matches.size()));

        List<Map<String, Object>> results = new ArrayList<>();
        List<SourceAttribution> sources = new ArrayList<>();
        for (Match match : top) {
            Passage passage = match.passage();
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("chunk_text", passage.text());
            result.put("title", passage.title());
            result.put("source_type", passage.sourceType());
            result.put("similarity", Math.round(match.similarity() * 1000) / 1000.0);
            result.put("chunk_index", passage.chunkIndex());
            result.put("token_count", passage.text().split("\\s+").length);
            results.add(result);
            sources.add(new SourceAttribution("knowledge:" + passage.title() + "#" + passage.chunkIndex(),
                    snippet(passage.text())));
        }
        log.debug("Knowledge search '{}' matched {} of {} passages", query, results.size(), PASSAGES.size());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("results", results);
        payload.put("total_results", results.size());
        payload.put("message", "Found " + results.size() + " relevant knowledge items");
        return ToolResult.success(payload, sources);
    }

    private static Set<String> terms(String text) {
        Set<String> terms = new LinkedHashSet<>();
        Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(term -> term.length() > 2 && !STOP_WORDS.contains(term))
                .forEach(terms::add);
        return terms;
    }

    private static String snippet(String text) {
        return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH) + "...";
    }

    private record Passage(String title, String sourceType, int chunkIndex, String text) {
    }

    private record Match(Passage passage, double similarity) {
    }
}
