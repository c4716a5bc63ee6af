package eu.virtualparadox.ragqa.rag.answer;

/**
 * Generative model seen as a black box: question and context in, answer text out.
 */
public interface AnswerGenerator {

    /**
     * @param question the user's question
     * @param context  assembled document context, empty when answering without documents
     * @return non-blank answer text
     * @throws eu.virtualparadox.ragqa.exception.GenerationUnavailableException if the model fails or answers nothing
     */
    String generate(String question, String context);
}
