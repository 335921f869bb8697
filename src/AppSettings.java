import com.google.gson.annotations.SerializedName;

/** User-facing settings persisted in the app config file. */
public final class AppSettings {

    public enum Theme {
        @SerializedName("light") LIGHT,
        @SerializedName("dark") DARK
    }

    public enum AiProvider {
        @SerializedName("openai") OPENAI,
        @SerializedName("gemini") GEMINI,
        @SerializedName("claude") CLAUDE,
        @SerializedName("deepseek") DEEPSEEK,
        @SerializedName("custom") CUSTOM
    }

    public Theme theme = Theme.LIGHT;
    public String accentColor;
    public Editor editor = new Editor();
    public int autoSaveInterval = 1000;
    public Ai ai = new Ai();

    public static final class Editor {
        public int fontSize = 16;
        public double lineHeight = 1.6;
        public boolean spellcheck = true;
    }

    public static final class Ai {
        public AiProvider provider = AiProvider.OPENAI;
        public String baseUrl = "https://api.openai.com/v1";
        public String apiKey = "";
        public String model = "gpt-4o";
    }

    AppSettings normalize() {
        if (theme == null) theme = Theme.LIGHT;
        if (editor == null) editor = new Editor();
        if (ai == null) ai = new Ai();
        if (ai.provider == null) ai.provider = AiProvider.OPENAI;
        return this;
    }
}
