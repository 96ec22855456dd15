package me.golemcore.humanloop.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.humanloop.domain.model.PizzaOrder;
import me.golemcore.humanloop.domain.service.RequestCancelledException;
import me.golemcore.humanloop.infrastructure.config.HumanLoopProperties;
import me.golemcore.humanloop.port.outbound.HumanInputPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Pizza ordering agent: a bounded tool loop over a langchain4j
 * {@link ChatModel}.
 *
 * <p>
 * Each iteration sends the conversation with two tools:
 * <ul>
 * <li>{@code ask_human} - suspends the loop on {@link HumanInputPort} until a
 * human answers, then feeds the answer back as the tool result
 * <li>{@code submit_order} - ends the loop with the structured order
 * </ul>
 *
 * <p>
 * The run blocks its calling thread while a question is open, so callers run
 * it on a worker executor (see AgentRunService) or on the console thread.
 */
@Component
@Slf4j
public class PizzaOrderAgent {

    static final String ASK_HUMAN = "ask_human";
    static final String SUBMIT_ORDER = "submit_order";

    private static final String SYSTEM_PROMPT = """
            You are an agent that helps a customer order pizza.
            The order may contain several pizzas, each with a size, a list of toppings and optional special instructions.
            When the request is missing a size, toppings or anything else you need, call ask_human with one short question.
            Ask one question per call. When the order is complete, call submit_order exactly once.
            """;

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private static final List<ToolSpecification> TOOLS = List.of(
            ToolSpecification.builder()
                    .name(ASK_HUMAN)
                    .description("Ask a human for clarification, additional information, or approval.")
                    .parameters(JsonObjectSchema.builder()
                            .addStringProperty("question", "The question to ask the human")
                            .required("question")
                            .build())
                    .build(),
            ToolSpecification.builder()
                    .name(SUBMIT_ORDER)
                    .description("Submit the final pizza order.")
                    .parameters(JsonObjectSchema.builder()
                            .addProperty("pizzas", JsonArraySchema.builder()
                                    .description("Pizzas in the order")
                                    .items(JsonObjectSchema.builder()
                                            .addStringProperty("size", "Pizza size, e.g. small, medium, large")
                                            .addProperty("toppings", JsonArraySchema.builder()
                                                    .description("Toppings")
                                                    .items(JsonStringSchema.builder().build())
                                                    .build())
                                            .addStringProperty("special_instructions",
                                                    "Optional special instructions")
                                            .required("size", "toppings")
                                            .build())
                                    .build())
                            .required("pizzas")
                            .build())
                    .build());

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final HumanInputPort humanInputPort;
    private final ObjectMapper objectMapper;
    private final int maxIterations;

    public PizzaOrderAgent(ObjectProvider<ChatModel> chatModelProvider, HumanInputPort humanInputPort,
            ObjectMapper objectMapper, HumanLoopProperties properties) {
        this.chatModelProvider = chatModelProvider;
        this.humanInputPort = humanInputPort;
        this.objectMapper = objectMapper;
        this.maxIterations = Math.max(1, properties.getLlm().getMaxIterations());
        log.info("PizzaOrderAgent max iterations: {}, human input via: {}", maxIterations,
                humanInputPort.getTransportName());
    }

    /**
     * Run the agent until it submits an order.
     *
     * @throws AgentExecutionException
     *             if no model is configured, a question was cancelled, or the
     *             iteration limit was reached
     */
    public PizzaOrder run(String customerRequest) {
        if (customerRequest == null || customerRequest.isBlank()) {
            throw new IllegalArgumentException("Customer request must not be blank");
        }
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new AgentExecutionException("LLM is not configured: set hitl.llm.api-key");
        }

        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(SYSTEM_PROMPT));
        messages.add(UserMessage.from(customerRequest));

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            ChatResponse response = chatModel.chat(ChatRequest.builder()
                    .messages(messages)
                    .toolSpecifications(TOOLS)
                    .build());
            AiMessage aiMessage = response.aiMessage();
            if (!aiMessage.hasToolExecutionRequests()) {
                throw new AgentExecutionException("Agent finished without submitting an order: " + aiMessage.text());
            }
            messages.add(aiMessage);

            for (ToolExecutionRequest call : aiMessage.toolExecutionRequests()) {
                log.debug("[Agent] Iteration {}: tool call {}", iteration, call.name());
                switch (call.name()) {
                case SUBMIT_ORDER -> {
                    PizzaOrder order = parseOrder(call.arguments());
                    log.info("[Agent] Order submitted after {} iteration(s): {} pizza(s)", iteration,
                            order.pizzas().size());
                    return order;
                }
                case ASK_HUMAN -> messages.add(ToolExecutionResultMessage.from(call, askHuman(call, iteration)));
                default -> messages.add(ToolExecutionResultMessage.from(call, "Unknown tool: " + call.name()));
                }
            }
        }
        throw new AgentExecutionException("Agent did not submit an order within " + maxIterations + " iterations");
    }

    private String askHuman(ToolExecutionRequest call, int iteration) {
        Object question = parseArguments(call.arguments()).get("question");
        if (!(question instanceof String text) || text.isBlank()) {
            return "Error: question is required";
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tool", ASK_HUMAN);
        metadata.put("iteration", iteration);
        CompletableFuture<String> pending = humanInputPort.requestInput(text, metadata);
        try {
            String answer = pending.get();
            log.debug("[Agent] Human answered: {}", answer);
            return answer;
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new AgentExecutionException("Agent interrupted while waiting for human input", e);
        } catch (ExecutionException e) {
            pending.cancel(true);
            Throwable cause = e.getCause();
            if (cause instanceof RequestCancelledException cancelled) {
                throw new AgentExecutionException("Human input cancelled: " + cancelled.getReason(), cancelled);
            }
            throw new AgentExecutionException("Human input failed: " + cause.getMessage(), cause);
        }
    }

    private PizzaOrder parseOrder(String arguments) {
        try {
            PizzaOrder order = objectMapper.readValue(arguments, PizzaOrder.class);
            if (order.isEmpty()) {
                throw new AgentExecutionException("Agent submitted an empty order");
            }
            return order;
        } catch (JsonProcessingException e) {
            throw new AgentExecutionException("Agent submitted a malformed order: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(arguments, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[Agent] Failed to parse tool arguments: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
