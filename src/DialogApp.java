import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

import java.io.PrintStream;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;
import java.util.Locale;

public final class DialogApp {
    private final StorageContext ctx;
    private final PrintStream out;

    DialogApp(StorageContext ctx, PrintStream out) {
        this.ctx = ctx;
        this.out = out;
    }

    public static void main(String[] args) {
        StorageContext ctx = new StorageContext(new LocalHost(), StorageSettings.load());
        int code;
        try {
            ctx.open();
            code = new DialogApp(ctx, System.out).run(args);
        } finally {
            ctx.close();
        }
        if (code != 0) System.exit(code);
    }

    int run(String[] args) {
        String cmd = args.length == 0 ? "list" : args[0].toLowerCase(Locale.ROOT);
        String arg = args.length > 1 ? args[1] : null;
        switch (cmd) {
            case "list":
                print(ctx.notes.listActive(), false);
                return 0;
            case "favorites":
                print(ctx.notes.listFavorites(), false);
                return 0;
            case "trash":
                print(ctx.notes.listTrash(), true);
                return 0;
            case "search":
                print(ctx.notes.search(joinFrom(args, 1)), false);
                return 0;
            case "new": {
                String title = args.length > 1 ? joinFrom(args, 1) : Note.DEFAULT_TITLE;
                String id = ctx.notes.create(title);
                ctx.workspace.setActiveNote(id);
                out.println(id);
                return 0;
            }
            case "open": {
                if (arg == null) return usage();
                Note n = ctx.notes.loadOrRecover(arg);
                ctx.workspace.setActiveNote(n.id);
                out.println(n.title);
                out.println(n.content == null ? "" : n.content.toString());
                return 0;
            }
            case "favorite":
                if (arg == null) return usage();
                ctx.notes.toggleFavorite(arg);
                return 0;
            case "delete":
                if (arg == null) return usage();
                ctx.notes.moveToTrash(arg);
                return 0;
            case "restore":
                if (arg == null) return usage();
                ctx.notes.restoreFromTrash(arg);
                return 0;
            case "purge":
                if (arg == null) return usage();
                ctx.notes.permanentlyDelete(arg);
                return 0;
            case "empty-trash":
                out.println(ctx.notes.emptyTrash() + " removed");
                return 0;
            case "config":
                return config(args);
            default:
                return usage();
        }
    }

    private int config(String[] args) {
        if (args.length == 1) {
            out.println(ctx.config.get("theme") + " / " + ctx.config.get("ai"));
            return 0;
        }
        if (args.length == 2) {
            JsonElement v = ctx.config.get(args[1]);
            out.println(v == null ? "(unset)" : v.toString());
            return 0;
        }
        String raw = joinFrom(args, 2);
        JsonElement value;
        try {
            value = JsonParser.parseString(raw);
        } catch (JsonSyntaxException e) {
            value = null;
        }
        try {
            if (value == null || value.isJsonNull()) {
                ctx.config.set(args[1], raw);
            } else {
                ctx.config.set(args[1], value);
            }
        } catch (IllegalArgumentException e) {
            out.println("config: " + e.getMessage());
            return 2;
        }
        return 0;
    }

    private void print(List<Note> list, boolean trash) {
        SimpleDateFormat fmt = new SimpleDateFormat("yyyy-MM-dd HH:mm", Locale.ROOT);
        for (int i = 0; i < list.size(); i++) {
            Note n = list.get(i);
            long ts = trash && n.deletedAt != null ? n.deletedAt.longValue() : n.updatedAt;
            out.println(n.id + "  " + fmt.format(new Date(ts)) + "  " + (n.favorite ? "* " : "  ") + n.title);
        }
    }

    private int usage() {
        out.println("usage: dialog [list|favorites|trash|search <q>|new [title]|open <id>|favorite <id>|"
                + "delete <id>|restore <id>|purge <id>|empty-trash|config [key [value]]]");
        return 2;
    }

    private static String joinFrom(String[] args, int from) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < args.length; i++) {
            if (i > from) sb.append(' ');
            sb.append(args[i]);
        }
        return sb.toString();
    }
}
