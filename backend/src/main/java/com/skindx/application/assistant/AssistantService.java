package com.skindx.application.assistant;

import com.skindx.infrastructure.ai.provider.AiProvider;
import com.skindx.infrastructure.ai.provider.ChatMessage;
import com.skindx.infrastructure.ai.provider.ProviderKind;
import com.skindx.infrastructure.ai.routing.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Conversational assistant for patients and doctors. OpenRouter answers with the
 * recent history; Groq is asked the bare question when OpenRouter cannot answer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssistantService {

    static final int HISTORY_LIMIT = 5;

    static final String FALLBACK_REPLY = "I'm currently unable to process your request due to "
            + "technical difficulties. Please try again in a few moments. "
            + "For urgent medical concerns, please consult a healthcare provider.";

    private static final String BASE_PROMPT = """
            You are a medical AI assistant for a skin diagnosis application.
            You provide helpful information about skin conditions, explain diagnoses,
            and offer general guidance. Always recommend consulting a dermatologist
            for serious concerns.

            IMPORTANT:
            - Do NOT provide definitive diagnoses
            - Always recommend professional consultation for concerning symptoms
            - Be empathetic and supportive
            - Answer based on verified medical information only
            - If uncertain, say so clearly
            """;

    private static final String PATIENT_PROMPT = """

            You are speaking with a patient. Be clear, avoid jargon, and be reassuring.
            Focus on education and understanding of skin conditions.
            """;

    private static final String DOCTOR_PROMPT = """

            You are speaking with a verified doctor. You can use medical terminology.
            Focus on clinical information, research, and treatment protocols.
            """;

    private final ProviderRegistry providerRegistry;

    /**
     * @param history      earlier turns, oldest first; only the last {@value #HISTORY_LIMIT} are sent
     * @param contextNotes recent diagnoses for a patient, specialties for a doctor
     * @return the model's reply, or a fixed apology when no provider answers
     */
    public String reply(String message, AssistantRole role, List<ChatMessage> history, List<String> contextNotes) {
        String systemPrompt = systemPrompt(role, contextNotes);

        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(systemPrompt));
        messages.addAll(lastTurns(history));
        messages.add(ChatMessage.user(message));

        Optional<String> answer = ask(ProviderKind.OPENROUTER, messages);
        if (answer.isPresent()) {
            return answer.get();
        }

        return ask(ProviderKind.GROQ, List.of(ChatMessage.system(systemPrompt), ChatMessage.user(message)))
                .orElse(FALLBACK_REPLY);
    }

    String systemPrompt(AssistantRole role, List<String> contextNotes) {
        StringBuilder prompt = new StringBuilder(BASE_PROMPT);
        boolean hasNotes = contextNotes != null && !contextNotes.isEmpty();
        if (role == AssistantRole.DOCTOR) {
            prompt.append(DOCTOR_PROMPT);
            if (hasNotes) prompt.append("\nDoctor's specialties: ").append(contextNotes);
        } else {
            prompt.append(PATIENT_PROMPT);
            if (hasNotes) prompt.append("\nPatient's recent diagnoses: ").append(contextNotes);
        }
        return prompt.toString();
    }

    private Optional<String> ask(ProviderKind kind, List<ChatMessage> messages) {
        Optional<AiProvider> provider = providerRegistry.resolve(kind);
        if (provider.isEmpty()) {
            log.debug("[Assistant] {} not available", kind.configName());
            return Optional.empty();
        }
        try {
            String reply = provider.get().chat(messages);
            if (reply == null || reply.isBlank()) {
                log.warn("[Assistant] {} returned an empty reply", kind.configName());
                return Optional.empty();
            }
            return Optional.of(reply);
        } catch (RuntimeException e) {
            log.error("[Assistant] {} chat failed: {}", kind.configName(), e.getMessage());
            return Optional.empty();
        }
    }

    private static List<ChatMessage> lastTurns(List<ChatMessage> history) {
        if (history == null || history.isEmpty()) return List.of();
        return history.subList(Math.max(0, history.size() - HISTORY_LIMIT), history.size());
    }
}
