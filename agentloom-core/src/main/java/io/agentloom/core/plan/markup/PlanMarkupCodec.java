package io.agentloom.core.plan.markup;

import io.agentloom.core.graph.ExecutionGraphCompiler;
import io.agentloom.core.plan.Plan;
import io.agentloom.core.plan.PlanAgent;
import io.agentloom.core.plan.PlanNode;
import io.agentloom.core.plan.PlanParseException;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/// Reads and writes the plan markup document.
///
/// The markup is both the planner's output format and the execution snapshot
/// format, so parsing and serialization must agree exactly:
/// `serialize(parse(serialize(p), true))` equals `serialize(p)`.
///
/// ### Partial documents
/// Planner output is streamed. With `isFinal == false` the codec completes the
/// truncated prefix via {@link MarkupRepair} and returns whatever plan can be
/// recovered; it never throws in that mode. A final parse is strict and compiles the
/// agents to assign their `parallel` flags.
///
/// ### Usage
/// {@snippet :
/// PlanMarkupCodec codec = new PlanMarkupCodec();
/// Plan draft = codec.parse("task-1", streamedPrefix, false, null);   // may be null
/// Plan plan = codec.parse("task-1", completeDocument, true, null);
/// String snapshot = codec.serialize(plan);
/// }
///
/// @implNote Thread-safe. A new DOM parser is created per call; the JDK's XML
/// factories are not safe for concurrent use.
///
/// @see MarkupRepair
/// @see ExecutionGraphCompiler
public class PlanMarkupCodec {

    private static final Logger logger = Logger.getLogger(PlanMarkupCodec.class.getName());

    private static final String ROOT_OPEN = "<root>";
    private static final String ROOT_CLOSE = "</root>";

    private final ExecutionGraphCompiler compiler;

    public PlanMarkupCodec() {
        this(new ExecutionGraphCompiler());
    }

    /// Creates a codec compiling final plans with the given compiler.
    ///
    /// @param compiler compiler used to assign `parallel` flags, not null
    public PlanMarkupCodec(ExecutionGraphCompiler compiler) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
    }

    /// Parses a plan document.
    ///
    /// ### Contracts
    /// - **Precondition**: `planId` and `text` are non-null
    /// - **Postcondition**: when `isFinal` is false, never throws
    /// - **Postcondition**: a returned plan has unique agent ids and named agents only
    ///
    /// @param planId task id used to derive agent ids, not null
    /// @param text full or partial document, not null
    /// @param isFinal whether the document is complete
    /// @param rationale externally produced reasoning prepended to `thought`, may be null
    /// @return parsed plan, a rationale-only plan when there is no root element yet but a
    ///     rationale was given, or null
    /// @throws PlanParseException if `isFinal` and the document is structurally invalid
    /// @throws io.agentloom.core.graph.GraphCompilationException if `isFinal` and the
    ///     agents cannot be compiled
    public Plan parse(String planId, String text, boolean isFinal, String rationale) {
        Objects.requireNonNull(planId, "planId must not be null");
        Objects.requireNonNull(text, "text must not be null");

        Plan fallback =
                rationale != null && !rationale.isEmpty()
                        ? new Plan(planId, "", rationale, List.of(), text)
                        : null;

        int start = text.indexOf(ROOT_OPEN);
        if (start == -1) {
            return fallback;
        }
        String markup = text.substring(start);
        int end = markup.indexOf(ROOT_CLOSE);
        if (end > -1) {
            markup = markup.substring(0, end + ROOT_CLOSE.length());
        }
        try {
            if (!isFinal) {
                markup = MarkupRepair.complete(markup);
            }
            Plan plan = read(planId, markup, isFinal, rationale);
            if (isFinal) {
                compiler.compile(plan.getAgents());
            }
            return plan;
        } catch (RuntimeException e) {
            if (isFinal) {
                throw e;
            }
            logger.fine("Partial plan not yet parseable: " + e);
            return fallback;
        }
    }

    /// Serializes the plan and refreshes its cached markup.
    ///
    /// @param plan plan to render, not null
    /// @return deterministic document text, never null
    public String serialize(Plan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        String markup = PlanMarkupWriter.plan(plan);
        plan.setMarkup(markup);
        return markup;
    }

    /// Renders a single `agent` element.
    ///
    /// @param agent agent to render, not null
    /// @return agent fragment, never null
    public String serializeAgent(PlanAgent agent) {
        return PlanMarkupWriter.agent(agent);
    }

    /// Renders the working brief of one agent: the overall task, the agent's own
    /// task and its steps numbered by position.
    ///
    /// @param agent agent to brief, not null
    /// @param mainTask overall task description, not null
    /// @return document text, never null
    public String agentTaskDocument(PlanAgent agent, String mainTask) {
        return PlanMarkupWriter.agentTaskDocument(agent, mainTask);
    }

    /// Resolves a step of an agent by its positional id.
    ///
    /// Only the agent fragment is parsed. Top-level elements of `nodes` are numbered
    /// from zero in document order unless they carry an explicit `id` attribute.
    ///
    /// @param agentMarkup the agent's `agent` element, not null
    /// @param nodeId positional id
    /// @return the node, or empty if no element has that id
    /// @throws PlanParseException if the fragment is not well-formed
    public Optional<PlanNode> extractNode(String agentMarkup, int nodeId) {
        Document document = document(agentMarkup);
        Element nodes = firstElement(document.getDocumentElement(), "nodes");
        if (nodes == null) {
            return Optional.empty();
        }
        int position = 0;
        for (Element child : childElements(nodes)) {
            String explicit = child.getAttribute("id");
            String id = explicit.isEmpty() ? String.valueOf(position) : explicit;
            position++;
            if (id.equals(String.valueOf(nodeId))) {
                List<PlanNode> parsed = new ArrayList<>();
                readNode(child, parsed);
                return parsed.stream().findFirst();
            }
        }
        return Optional.empty();
    }

    /// Builds a single-agent plan running the given steps.
    ///
    /// @param planId task id, not null
    /// @param name plan name, not null
    /// @param agentName capability provider name, not null
    /// @param task task text, not null
    /// @param steps step texts; when empty the task text becomes the only step
    /// @return plan with serialized markup and compiled flags, never null
    public Plan singleAgentPlan(
            String planId, String name, String agentName, String task, List<String> steps) {
        List<String> texts = steps == null || steps.isEmpty() ? List.of(task) : steps;
        List<PlanNode> nodes = new ArrayList<>();
        for (String text : texts) {
            nodes.add(PlanNode.Step.of(text));
        }
        PlanAgent agent =
                new PlanAgent(
                        PlanAgent.agentId(planId, "0"), agentName, List.of(), task, nodes, null);
        Plan plan = new Plan(planId, name, "", List.of(agent), null);
        compiler.compile(plan.getAgents());
        serialize(plan);
        return plan;
    }

    private Plan read(String planId, String markup, boolean isFinal, String rationale) {
        Element root = document(markup).getDocumentElement();
        if (!"root".equals(root.getTagName())) {
            throw new PlanParseException("Unexpected document element: " + root.getTagName());
        }

        String thought = textOf(firstElement(root, "thought"));
        if (rationale != null && !rationale.isEmpty()) {
            thought = thought.isEmpty() ? rationale : rationale + "\n" + thought;
        }

        List<PlanAgent> agents = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Element agentsElement = firstElement(root, "agents");
        if (agentsElement != null) {
            int index = 0;
            for (Element agentElement : childElements(agentsElement)) {
                if (!"agent".equals(agentElement.getTagName())) {
                    continue;
                }
                String name = agentElement.getAttribute("name");
                if (name.isEmpty()) {
                    if (isFinal) {
                        throw new PlanParseException("Agent at position " + index + " has no name");
                    }
                    break;
                }
                PlanAgent agent = readAgent(planId, agentElement, index++);
                if (!seen.add(agent.getId())) {
                    if (isFinal) {
                        throw new PlanParseException("Duplicate agent id: " + agent.getId());
                    }
                    break;
                }
                agents.add(agent);
            }
        }

        return new Plan(planId, textOf(firstElement(root, "name")), thought, agents, markup);
    }

    private PlanAgent readAgent(String planId, Element element, int index) {
        String ordinal = element.getAttribute("id");
        if (ordinal.isBlank()) {
            ordinal = String.valueOf(index);
        }
        List<String> dependsOn = new ArrayList<>();
        for (String dep : element.getAttribute("dependsOn").split(",")) {
            if (!dep.isBlank()) {
                dependsOn.add(PlanAgent.agentId(planId, dep));
            }
        }
        List<PlanNode> nodes = new ArrayList<>();
        Element nodesElement = firstElement(element, "nodes");
        if (nodesElement != null) {
            for (Element child : childElements(nodesElement)) {
                readNode(child, nodes);
            }
        }
        return new PlanAgent(
                PlanAgent.agentId(planId, ordinal),
                element.getAttribute("name"),
                dependsOn,
                textOf(firstElement(element, "task")),
                nodes,
                outerMarkup(element));
    }

    private void readNode(Element element, List<PlanNode> into) {
        switch (element.getTagName()) {
            case "node" -> into.add(readStep(element));
            case "forEach" -> {
                List<PlanNode.Step> steps = new ArrayList<>();
                NodeList nested = element.getElementsByTagName("node");
                for (int i = 0; i < nested.getLength(); i++) {
                    steps.add(readStep((Element) nested.item(i)));
                }
                String items = element.getAttribute("items");
                into.add(new PlanNode.ForEach(items.isEmpty() ? PlanNode.DEFAULT_ITEMS : items, steps));
            }
            case "watch" -> {
                List<PlanNode> triggers = new ArrayList<>();
                Element trigger = firstElement(element, "trigger");
                if (trigger != null) {
                    for (Element child : childElements(trigger)) {
                        readNode(child, triggers);
                    }
                }
                String event = element.getAttribute("event");
                into.add(
                        new PlanNode.Watch(
                                event.isEmpty() ? PlanNode.DEFAULT_WATCH_EVENT : event,
                                "true".equals(element.getAttribute("loop")),
                                textOf(firstElement(element, "description")),
                                triggers));
            }
            default -> logger.fine("Ignoring unknown plan element <" + element.getTagName() + ">");
        }
    }

    private static PlanNode.Step readStep(Element element) {
        return new PlanNode.Step(
                element.getTextContent(),
                emptyToNull(element.getAttribute("input")),
                emptyToNull(element.getAttribute("output")));
    }

    private static Document document(String markup) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(markup)));
        } catch (SAXException | IOException e) {
            throw new PlanParseException("Malformed plan markup: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        }
    }

    private static String outerMarkup(Element element) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(element), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new PlanParseException("Unable to render agent markup", e);
        }
    }

    /// Direct child first, then any descendant, mirroring how planners nest elements.
    private static Element firstElement(Element parent, String tag) {
        for (Element child : childElements(parent)) {
            if (tag.equals(child.getTagName())) {
                return child;
            }
        }
        NodeList descendants = parent.getElementsByTagName(tag);
        return descendants.getLength() > 0 ? (Element) descendants.item(0) : null;
    }

    private static List<Element> childElements(Element parent) {
        List<Element> elements = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) child);
            }
        }
        return elements;
    }

    private static String textOf(Element element) {
        return element != null ? element.getTextContent() : "";
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
