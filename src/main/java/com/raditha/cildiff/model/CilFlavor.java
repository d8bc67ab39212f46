package com.raditha.cildiff.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Discriminant of a CIL AST node.
 * <p>
 * Every flavor carries the keyword it is written with (null for flavors that only occur
 * implicitly, such as the root or the permissions listed inside a class declaration),
 * whether its children form a comparable set, and the policy used to pair members that
 * share an identity within a set.
 */
public enum CilFlavor {
    ROOT(null, true, MatchingPolicy.SINGLE),

    // access vector rules
    ALLOW("allow"),
    AUDITALLOW("auditallow"),
    DONTAUDIT("dontaudit"),
    NEVERALLOW("neverallow"),
    ALLOWX("allowx"),
    AUDITALLOWX("auditallowx"),
    DONTAUDITX("dontauditx"),
    NEVERALLOWX("neverallowx"),
    DENY("deny"),

    // call and macro
    CALL("call"),
    MACRO("macro", true, MatchingPolicy.SINGLE),

    // classes and permissions
    PERM(null),
    MAP_PERM(null),
    COMMON("common", true, MatchingPolicy.SINGLE),
    CLASSCOMMON("classcommon"),
    CLASS("class", true, MatchingPolicy.SINGLE),
    CLASSORDER("classorder"),
    CLASSPERMISSION("classpermission"),
    CLASSPERMISSIONSET("classpermissionset"),
    CLASSMAP("classmap", true, MatchingPolicy.SINGLE),
    CLASSMAPPING("classmapping"),
    PERMISSIONX("permissionx"),
    CLASSPERMS(null),
    CLASSPERMS_SET(null),

    // conditionals
    BOOLEAN("boolean"),
    BOOLEANIF("booleanif", true, MatchingPolicy.SIMILARITY),
    TUNABLE("tunable"),
    TUNABLEIF("tunableif", true, MatchingPolicy.SIMILARITY),
    CONDTRUE("true", true, MatchingPolicy.SINGLE),
    CONDFALSE("false", true, MatchingPolicy.SINGLE),

    // constraints
    CONSTRAIN("constrain"),
    VALIDATETRANS("validatetrans"),
    MLSCONSTRAIN("mlsconstrain"),
    MLSVALIDATETRANS("mlsvalidatetrans"),

    // containers
    BLOCK("block", true, MatchingPolicy.SINGLE),
    BLOCKABSTRACT("blockabstract"),
    BLOCKINHERIT("blockinherit"),
    OPTIONAL("optional", true, MatchingPolicy.SIMILARITY),
    IN("in", true, MatchingPolicy.SIMILARITY),

    CONTEXT("context"),

    // default object
    DEFAULTUSER("defaultuser"),
    DEFAULTROLE("defaultrole"),
    DEFAULTTYPE("defaulttype"),
    DEFAULTRANGE("defaultrange"),

    // file labeling
    FILECON("filecon"),
    FSUSE("fsuse"),
    GENFSCON("genfscon"),

    // infiniband
    IBPKEYCON("ibpkeycon"),
    IBENDPORTCON("ibendportcon"),

    // multi-level security
    SENSITIVITY("sensitivity"),
    SENSITIVITYALIAS("sensitivityalias"),
    SENSITIVITYALIASACTUAL("sensitivityaliasactual"),
    SENSITIVITYORDER("sensitivityorder"),
    CATEGORY("category"),
    CATEGORYALIAS("categoryalias"),
    CATEGORYALIASACTUAL("categoryaliasactual"),
    CATEGORYORDER("categoryorder"),
    CATEGORYSET("categoryset"),
    SENSITIVITYCATEGORY("sensitivitycategory"),
    LEVEL("level"),
    LEVELRANGE("levelrange"),
    RANGETRANSITION("rangetransition"),

    // network labeling
    IPADDR("ipaddr"),
    NETIFCON("netifcon"),
    NODECON("nodecon"),
    PORTCON("portcon"),

    // policy configuration
    MLS("mls"),
    HANDLEUNKNOWN("handleunknown"),
    POLICYCAP("policycap"),

    // roles
    ROLE("role"),
    ROLETYPE("roletype"),
    ROLEATTRIBUTE("roleattribute"),
    ROLEATTRIBUTESET("roleattributeset"),
    ROLEALLOW("roleallow"),
    ROLETRANSITION("roletransition"),
    ROLEBOUNDS("rolebounds"),

    // security identifiers
    SID("sid"),
    SIDORDER("sidorder"),
    SIDCONTEXT("sidcontext"),

    // types
    TYPE("type"),
    TYPEALIAS("typealias"),
    TYPEALIASACTUAL("typealiasactual"),
    TYPEATTRIBUTE("typeattribute"),
    TYPEATTRIBUTESET("typeattributeset"),
    EXPANDTYPEATTRIBUTE("expandtypeattribute"),
    TYPEBOUNDS("typebounds"),
    TYPETRANSITION("typetransition"),
    TYPECHANGE("typechange"),
    TYPEMEMBER("typemember"),
    NAMETYPETRANSITION("typetransition"),
    TYPEPERMISSIVE("typepermissive"),

    // users
    USER("user"),
    USERROLE("userrole"),
    USERATTRIBUTE("userattribute"),
    USERATTRIBUTESET("userattributeset"),
    USERLEVEL("userlevel"),
    USERRANGE("userrange"),
    USERBOUNDS("userbounds"),
    USERPREFIX("userprefix"),
    SELINUXUSER("selinuxuser"),
    SELINUXUSERDEFAULT("selinuxuserdefault"),

    // xen
    IOMEMCON("iomemcon"),
    IOPORTCON("ioportcon"),
    PCIDEVICECON("pcidevicecon"),
    PIRQCON("pirqcon"),
    DEVICETREECON("devicetreecon");

    private static final Map<String, CilFlavor> BY_KEYWORD = new HashMap<>();

    static {
        for (CilFlavor flavor : values()) {
            if (flavor.keyword != null) {
                // the named variant of typetransition shares its keyword
                BY_KEYWORD.putIfAbsent(flavor.keyword, flavor);
            }
        }
    }

    private final String keyword;
    private final boolean container;
    private final MatchingPolicy matchingPolicy;

    CilFlavor(String keyword) {
        this(keyword, false, MatchingPolicy.FLAT);
    }

    CilFlavor(String keyword, boolean container, MatchingPolicy matchingPolicy) {
        this.keyword = keyword;
        this.container = container;
        this.matchingPolicy = matchingPolicy;
    }

    /**
     * Look up the flavor of a statement keyword.
     *
     * @return the flavor, or null if the keyword is not a CIL statement
     */
    public static CilFlavor fromKeyword(String keyword) {
        return BY_KEYWORD.get(keyword);
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean isContainer() {
        return container;
    }

    public MatchingPolicy getMatchingPolicy() {
        return matchingPolicy;
    }

    /**
     * The disambiguating tag that starts every digest of this flavor.
     */
    public String getTag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Human readable name used in diagnostics and report context lines.
     */
    public String getDisplayName() {
        return keyword != null ? keyword : getTag();
    }

    public boolean isConditional() {
        return this == BOOLEANIF || this == TUNABLEIF;
    }

    public boolean isBranch() {
        return this == CONDTRUE || this == CONDFALSE;
    }
}
