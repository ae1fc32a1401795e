package org.calista.arasaka.blueprint.intent;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.blueprint.intent.impl.PatternIntentDetector;
import org.calista.arasaka.blueprint.tokenizer.Lexicon;
import org.calista.arasaka.blueprint.tokenizer.PartOfSpeech;
import org.calista.arasaka.blueprint.tokenizer.Token;
import org.calista.arasaka.blueprint.tokenizer.Tokenizer;
import org.calista.arasaka.blueprint.tokenizer.impl.LexicalTokenizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point of text understanding: normalize, tokenize, then classify.
 *
 * <p>Named entities are scanned on the original text (person names need capitals);
 * everything else works on the normalized form.</p>
 */
public final class InputParser {

    private static final Logger log = LogManager.getLogger(InputParser.class);

    private static final Map<SemanticIntent, Pattern> SEMANTIC_PATTERNS = semanticPatterns();

    private record EntityRule(Pattern pattern, NamedEntity.Type type) {}

    private static final List<EntityRule> ENTITY_RULES = List.of(
            new EntityRule(Pattern.compile("\\$[\\d,]+(\\.\\d{2})?"), NamedEntity.Type.MONEY),
            new EntityRule(Pattern.compile("\\d{1,2}[/\\-]\\d{1,2}[/\\-]\\d{2,4}"), NamedEntity.Type.DATE),
            new EntityRule(Pattern.compile("\\d{1,2}:\\d{2}\\s*(am|pm)?", Pattern.CASE_INSENSITIVE), NamedEntity.Type.TIME),
            new EntityRule(Pattern.compile("\\d+\\s*(hours?|days?|weeks?|months?|years?)", Pattern.CASE_INSENSITIVE), NamedEntity.Type.QUANTITY),
            new EntityRule(Pattern.compile("\\b[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)+\\b"), NamedEntity.Type.PERSON)
    );

    static final double ENTITY_CONFIDENCE = 0.8;

    private final Tokenizer tokenizer;
    private final IntentDetector intentDetector;

    public InputParser() {
        this(new LexicalTokenizer(), new PatternIntentDetector());
    }

    public InputParser(Tokenizer tokenizer, IntentDetector intentDetector) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.intentDetector = Objects.requireNonNull(intentDetector, "intentDetector");
    }

    public Tokenizer tokenizer() {
        return tokenizer;
    }

    public ParsedInput parse(String text) {
        final String original = text == null ? "" : text;
        final String normalized = tokenizer.normalize(original);
        final List<Token> tokens = tokenizer.tokenize(normalized);

        IntentMatch intent = intentDetector.detect(normalized, tokens);

        List<String> actions = new ArrayList<>();
        List<String> nouns = new ArrayList<>();
        List<String> adjectives = new ArrayList<>();
        for (Token t : tokens) {
            if (t.is(PartOfSpeech.VERB) && Lexicon.isActionVerb(t.lemma())) actions.add(t.lemma());
            if (t.is(PartOfSpeech.NOUN) && !Lexicon.isStopWord(t.lemma())) nouns.add(t.lemma());
            if (t.is(PartOfSpeech.ADJECTIVE)) adjectives.add(t.lemma());
        }

        ParsedInput out = new ParsedInput(
                original,
                normalized,
                intent,
                tokens,
                actions,
                nouns,
                adjectives,
                extractPhrases(tokens),
                detectSemanticIntents(normalized),
                extractNamedEntities(original),
                extractModifiers(tokens)
        );

        if (log.isDebugEnabled()) {
            log.debug("parse {} actions={} nouns={} entities={}", out, actions, nouns, out.namedEntities.size());
        }
        return out;
    }

    // -------------------- Semantic intents --------------------

    /**
     * Every category whose pattern occurs anywhere in the text.
     */
    public static Set<SemanticIntent> detectSemanticIntents(String text) {
        EnumSet<SemanticIntent> out = EnumSet.noneOf(SemanticIntent.class);
        if (text == null || text.isEmpty()) return out;

        for (Map.Entry<SemanticIntent, Pattern> e : SEMANTIC_PATTERNS.entrySet()) {
            if (e.getValue().matcher(text).find()) out.add(e.getKey());
        }
        return out;
    }

    private static Map<SemanticIntent, Pattern> semanticPatterns() {
        int ci = Pattern.CASE_INSENSITIVE;
        EnumMap<SemanticIntent, Pattern> m = new EnumMap<>(SemanticIntent.class);
        m.put(SemanticIntent.TRACKING, Pattern.compile("track(ing)?|monitor(ing)?|follow|watch|log(ging)?", ci));
        m.put(SemanticIntent.SCHEDULING, Pattern.compile("schedul(e|ing)|appoint(ment)?|book(ing)?|calendar|plan(ning)?", ci));
        m.put(SemanticIntent.MANAGING, Pattern.compile("manag(e|ing|ement)|organiz(e|ing)|handle|control", ci));
        m.put(SemanticIntent.ORGANIZING, Pattern.compile("organiz(e|ing)|sort(ing)?|categor(y|ize)|group(ing)?", ci));
        m.put(SemanticIntent.COMMUNICATING, Pattern.compile("send|message|notify|alert|communicate|email|sms", ci));
        m.put(SemanticIntent.BILLING, Pattern.compile("invoice|bill(ing)?|payment|charge|price|cost|money", ci));
        m.put(SemanticIntent.REPORTING, Pattern.compile("report(ing)?|analyz(e|ing)|analytic|statistic|dashboard|metric", ci));
        m.put(SemanticIntent.COLLABORATING, Pattern.compile("team|collaborat(e|ion)|share|together|assign|delegate", ci));
        m.put(SemanticIntent.AUTOMATING, Pattern.compile("automat(e|ion)|workflow|trigger|when.*then|if.*then", ci));
        m.put(SemanticIntent.MONITORING, Pattern.compile("monitor(ing)?|watch|observ(e|ing)|check|status", ci));
        return Collections.unmodifiableMap(m);
    }

    // -------------------- Named entities --------------------

    /**
     * Scans rule by rule, left to right within a rule. Spans index into {@code text}.
     */
    public static List<NamedEntity> extractNamedEntities(String text) {
        if (text == null || text.isEmpty()) return List.of();

        List<NamedEntity> out = new ArrayList<>();
        for (EntityRule r : ENTITY_RULES) {
            Matcher m = r.pattern.matcher(text);
            while (m.find()) {
                out.add(new NamedEntity(m.group(), r.type, m.start(), m.end(), ENTITY_CONFIDENCE));
            }
        }
        return out;
    }

    // -------------------- Modifiers --------------------

    public static List<Modifier> extractModifiers(List<Token> tokens) {
        List<Modifier> out = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            String next = i + 1 < tokens.size() ? tokens.get(i + 1).text() : null;
            String lemma = t.lemma();

            if (Lexicon.QUANTITY_WORDS.contains(lemma)) {
                out.add(new Modifier(t.text(), Modifier.Type.QUANTITY, next));
            } else if (Lexicon.PRIORITY_WORDS.contains(lemma)) {
                out.add(new Modifier(t.text(), Modifier.Type.PRIORITY, next));
            } else if (Lexicon.TIME_WORDS.contains(lemma)) {
                out.add(new Modifier(t.text(), Modifier.Type.TIME, null));
            } else if (Lexicon.STATUS_WORDS.contains(lemma)) {
                out.add(new Modifier(t.text(), Modifier.Type.STATUS, next));
            } else if (Lexicon.STYLE_ADJECTIVES.contains(lemma)) {
                out.add(new Modifier(t.text(), Modifier.Type.STYLE, null));
            }
        }
        return out;
    }

    // -------------------- Phrases --------------------

    /**
     * Runs of at least two consecutive salient (importance &gt; 0.5), non-stop-word tokens.
     */
    public static List<String> extractPhrases(List<Token> tokens) {
        List<String> out = new ArrayList<>();
        List<String> run = new ArrayList<>();

        for (Token t : tokens) {
            if (t.importance() > 0.5 && !Lexicon.isStopWord(t.lemma())) {
                run.add(t.text());
            } else if (!run.isEmpty()) {
                if (run.size() >= 2) out.add(String.join(" ", run));
                run.clear();
            }
        }
        if (run.size() >= 2) out.add(String.join(" ", run));
        return out;
    }
}
