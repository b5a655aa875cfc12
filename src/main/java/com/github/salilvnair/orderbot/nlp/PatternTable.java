package com.github.salilvnair.orderbot.nlp;

import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.LanguageCode;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Ordered intent rules plus the size, filler-word and word-number tables used to
 * normalize item text. Rule order is significant: the first matching rule wins.
 */
@Component
public class PatternTable {

    public static final int FLAGS = Pattern.CASE_INSENSITIVE
            | Pattern.UNICODE_CASE
            | Pattern.UNICODE_CHARACTER_CLASS;

    public static final String GROUP_FULL_INPUT = "fullInput";
    public static final String GROUP_ORDER_ID = "orderId";
    public static final String GROUP_ITEM = "item";

    private static final String EN_WORD_NUMBERS = "one|two|three|four|five|six|seven|eight|nine|ten";

    private final List<PatternRule> rules = new ArrayList<>();
    private final Map<String, LinkedHashMap<String, Pattern>> sizePatterns = new HashMap<>();
    private final Map<String, List<String>> fillerWords = new HashMap<>();
    private final Map<String, Map<String, Integer>> wordNumbers = new HashMap<>();

    public PatternTable() {
        registerRules();
        registerSizes();
        registerFillers();
        registerWordNumbers();
    }

    public List<PatternRule> rules(String language) {
        return rules.stream().filter(r -> r.language().equals(language)).toList();
    }

    public List<PatternRule> allRules() {
        return Collections.unmodifiableList(rules);
    }

    /** Size code to pattern, in lookup order. Unknown languages get the English table. */
    public Map<String, Pattern> sizePatterns(String language) {
        return sizePatterns.getOrDefault(language, sizePatterns.get(LanguageCode.EN));
    }

    public List<String> fillerWords(String language) {
        return fillerWords.getOrDefault(language, List.of());
    }

    public Map<String, Integer> wordNumbers(String language) {
        return wordNumbers.getOrDefault(language, wordNumbers.get(LanguageCode.EN));
    }

    private void registerRules() {
        // welcome
        en(IntentCode.WELCOME, "\\b(hi|hello|hey)\\b");
        ar(IntentCode.WELCOME, "(اهلا|مرحبا|هاي)");

        // track_order
        en(IntentCode.TRACK_ORDER, "(track|status of) my order(?: number (?<orderId>\\d+))?", GROUP_ORDER_ID);
        ar(IntentCode.TRACK_ORDER, "(عايز اعرف|حالة) طلبي(?: رقم (?<orderId>\\d+))?", GROUP_ORDER_ID);

        // add_item
        en(IntentCode.ADD_ITEM,
                "(?:add|order|i want to order|i want|get me|give me)\\s+(?:a\\s+)?(?<fullInput>[\\w\\s,]+?)(?:\\s+(?:please|thanks|thank you))?$",
                GROUP_FULL_INPUT);
        en(IntentCode.ADD_ITEM,
                "^(?<fullInput>(?:\\d+|(?:" + EN_WORD_NUMBERS + ")\\b)\\s*[a-z][\\w\\s,]*)$",
                GROUP_FULL_INPUT);
        ar(IntentCode.ADD_ITEM,
                "(?:ضيف|طلب|عايز)\\s+(?<fullInput>[\\w\\s]+?)(?:\\s+(?:من فضلك|شكرا))?$",
                GROUP_FULL_INPUT);

        // remove_item
        en(IntentCode.REMOVE_ITEM, "(?:remove|delete|cancel)\\s+(?<item>[\\d\\w\\s]+)", GROUP_ITEM);
        ar(IntentCode.REMOVE_ITEM, "(?:شيل|احذف) (?<item>[\\w\\s]+)", GROUP_ITEM);

        // view_cart
        en(IntentCode.VIEW_CART, "(show|view|what|see) (?:my )?cart");
        en(IntentCode.VIEW_CART, "(what|how much|what's) (?:is )?(?:the |my )?total");
        en(IntentCode.VIEW_CART, "(how much|what) (?:do |did )?i (?:order|have|spend)");
        en(IntentCode.VIEW_CART, "(what's|show) (?:my )?(?:order|price)");
        ar(IntentCode.VIEW_CART, "(اعرض|شف) (?:سلة )?الطلب|كام في السلة");
        ar(IntentCode.VIEW_CART, "(كام|إيه|ايه) (?:المجموع|السعر)");

        // clear_cart
        en(IntentCode.CLEAR_CART, "(clear|empty|reset|cancel) (?:my )?cart");
        ar(IntentCode.CLEAR_CART, "(امسح|فضي|الغي) (?:السلة|الطلب)");

        // checkout
        en(IntentCode.CHECKOUT, "(checkout|confirm|place order|pay|complete)");
        ar(IntentCode.CHECKOUT, "(ادفع|اكمل|اتمم الطلب|قرر)");

        // browse_menu
        en(IntentCode.BROWSE_MENU, "(what do you have|show menu|menu|pizza|items)");
        ar(IntentCode.BROWSE_MENU, "(في إيه|قائمة|عندك إيه|بيتزا)");

        // new_order
        en(IntentCode.NEW_ORDER, "(new order|start order)");
        ar(IntentCode.NEW_ORDER, "(طلب جديد|ابدأ طلب)");

        // confirmation / rejection
        en(IntentCode.CONFIRMATION,
                "^(yes|yeah|yep|yup|sure|ok|okay|correct|right|fine|alright|sounds good|that's right)$");
        ar(IntentCode.CONFIRMATION, "^(نعم|ايوة|ماشي|تمام|صح)$");
        en(IntentCode.REJECTION, "^(no|nope|nah|not really|incorrect|wrong|cancel that)$");
        ar(IntentCode.REJECTION, "^(لا|مش صح|غلط)$");
    }

    private void registerSizes() {
        LinkedHashMap<String, Pattern> en = new LinkedHashMap<>();
        en.put("S", Pattern.compile("\\b(small|s)\\b", FLAGS));
        en.put("M", Pattern.compile("\\b(medium|m)\\b", FLAGS));
        en.put("L", Pattern.compile("\\b(large|l)\\b", FLAGS));
        en.put("REG", Pattern.compile("\\b(regular|reg)\\b", FLAGS));
        sizePatterns.put(LanguageCode.EN, en);

        LinkedHashMap<String, Pattern> ar = new LinkedHashMap<>();
        ar.put("S", Pattern.compile("\\b(صغير|ص)\\b", FLAGS));
        ar.put("M", Pattern.compile("\\b(متوسط|م)\\b", FLAGS));
        ar.put("L", Pattern.compile("\\b(كبير|ك)\\b", FLAGS));
        ar.put("REG", Pattern.compile("\\b(عادي|عاد)\\b", FLAGS));
        sizePatterns.put(LanguageCode.AR, ar);
    }

    private void registerFillers() {
        fillerWords.put(LanguageCode.EN, List.of("a", "an", "the", "some"));
        fillerWords.put(LanguageCode.AR, List.of());
    }

    private void registerWordNumbers() {
        Map<String, Integer> en = new LinkedHashMap<>();
        String[] enWords = EN_WORD_NUMBERS.split("\\|");
        for (int i = 0; i < enWords.length; i++) {
            en.put(enWords[i], i + 1);
        }
        wordNumbers.put(LanguageCode.EN, en);

        Map<String, Integer> ar = new LinkedHashMap<>();
        String[] arWords = {"واحد", "اتنين", "تلاتة", "اربعة", "خمسة", "ستة", "سبعة", "تمانية", "تسعة", "عشرة"};
        for (int i = 0; i < arWords.length; i++) {
            ar.put(arWords[i], i + 1);
        }
        wordNumbers.put(LanguageCode.AR, ar);
    }

    private void en(String intent, String regex, String... groups) {
        rules.add(new PatternRule(intent, LanguageCode.EN, Pattern.compile(regex, FLAGS), List.of(groups)));
    }

    private void ar(String intent, String regex, String... groups) {
        rules.add(new PatternRule(intent, LanguageCode.AR, Pattern.compile(regex, FLAGS), List.of(groups)));
    }
}
