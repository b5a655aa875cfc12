package com.github.salilvnair.orderbot.support;

public final class TestConstants {

    private TestConstants() {
    }

    public static final Long USER_ID = 42L;
    public static final Long OTHER_USER_ID = 7L;

    public static final String TEXT_ADD_LARGE_MARGHERITA = "add large margherita pizza";
    public static final String TEXT_ADD_PIZZA = "add pizza";
    public static final String TEXT_LARGE = "large";
    public static final String TEXT_TWO_ITEMS_DIGITS = "1 fries 2 cola";
    public static final String TEXT_TWO_ITEMS_AND = "fries and cola";
    public static final String TEXT_ONE_LARGE_PIZZA = "1 large pizza";
    public static final String TEXT_ADD_UNKNOWN_PIZZA = "add large chicken pizza";
    public static final String TEXT_YES = "yes";
    public static final String TEXT_NO = "no";
    public static final String TEXT_CHECKOUT = "checkout";
    public static final String TEXT_SHOW_CART = "show my cart";
    public static final String TEXT_GIBBERISH = "qwerty asdf";

    public static final String MARGHERITA = "Margherita Pizza";
    public static final String FRIES = "Fries";
    public static final String COLA = "Cola";
    public static final String MANGO_JUICE = "Mango Juice";

    public static final String SIZE_S = "S";
    public static final String SIZE_L = "L";
    public static final String SIZE_REG = "REG";

    public static final String GENERATED_REPLY = "Here is a friendly generated reply";
    public static final String HALLUCINATED_CHECKOUT = "Your 12 pizzas cost 1 EGP!";
}
