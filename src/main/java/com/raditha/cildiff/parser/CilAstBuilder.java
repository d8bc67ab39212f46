package com.raditha.cildiff.parser;

import com.raditha.cildiff.model.AccessVectorRule;
import com.raditha.cildiff.model.Association;
import com.raditha.cildiff.model.AttributeSet;
import com.raditha.cildiff.model.BooleanDecl;
import com.raditha.cildiff.model.Branch;
import com.raditha.cildiff.model.Call;
import com.raditha.cildiff.model.CategorySet;
import com.raditha.cildiff.model.CilData;
import com.raditha.cildiff.model.CilExpr;
import com.raditha.cildiff.model.CilFlavor;
import com.raditha.cildiff.model.CilNode;
import com.raditha.cildiff.model.ClassMapping;
import com.raditha.cildiff.model.ClassPermissionSet;
import com.raditha.cildiff.model.ClassPerms;
import com.raditha.cildiff.model.Conditional;
import com.raditha.cildiff.model.Constraint;
import com.raditha.cildiff.model.Context;
import com.raditha.cildiff.model.DefaultObject;
import com.raditha.cildiff.model.DeviceCon;
import com.raditha.cildiff.model.DeviceTreeCon;
import com.raditha.cildiff.model.ExpandTypeAttribute;
import com.raditha.cildiff.model.ExprOperator;
import com.raditha.cildiff.model.ExtendedAccessVectorRule;
import com.raditha.cildiff.model.FileCon;
import com.raditha.cildiff.model.FsUse;
import com.raditha.cildiff.model.GenFsCon;
import com.raditha.cildiff.model.IbEndPortCon;
import com.raditha.cildiff.model.IbPkeyCon;
import com.raditha.cildiff.model.InStatement;
import com.raditha.cildiff.model.IpAddr;
import com.raditha.cildiff.model.Level;
import com.raditha.cildiff.model.LevelRange;
import com.raditha.cildiff.model.Macro;
import com.raditha.cildiff.model.NameStatement;
import com.raditha.cildiff.model.NetIfCon;
import com.raditha.cildiff.model.NodeCon;
import com.raditha.cildiff.model.OrderStatement;
import com.raditha.cildiff.model.PermissionX;
import com.raditha.cildiff.model.PolicyModelException;
import com.raditha.cildiff.model.PolicySetting;
import com.raditha.cildiff.model.PortCon;
import com.raditha.cildiff.model.RangeTransition;
import com.raditha.cildiff.model.Ref;
import com.raditha.cildiff.model.SelinuxUser;
import com.raditha.cildiff.model.SensitivityCategory;
import com.raditha.cildiff.model.SidContext;
import com.raditha.cildiff.model.TransitionRule;
import com.raditha.cildiff.model.UserLevel;
import com.raditha.cildiff.model.UserRange;
import com.raditha.cildiff.model.ValidateTrans;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds a {@link CilNode} tree from CIL source.
 * <p>
 * The builder checks the shape of every statement but does not resolve names; references
 * to undeclared types or classes are accepted as written.
 */
public class CilAstBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CilAstBuilder.class);

    private static final Set<String> FILE_TYPES = Set.of(
            "file", "dir", "char", "block", "socket", "pipe", "symlink", "any");

    private final SExpressionReader reader;

    public CilAstBuilder() {
        this(new SExpressionReader());
    }

    public CilAstBuilder(SExpressionReader reader) {
        this.reader = reader;
    }

    /**
     * Parse CIL source into a tree rooted at a synthetic root node.
     *
     * @param text the policy source
     * @return the root node
     * @throws CilParseException if the text is not well-formed CIL
     */
    public CilNode build(String text) throws CilParseException {
        List<SExpression> statements = reader.read(text);
        CilNode root = CilNode.root(buildStatements(statements, 0));
        logger.debug("Built CIL tree with {} top-level statements and {} nodes",
                root.getChildren().size(), root.size() - 1);
        return root;
    }

    private List<CilNode> buildStatements(List<SExpression> statements, int from) throws CilParseException {
        List<CilNode> nodes = new ArrayList<>();
        for (int i = from; i < statements.size(); i++) {
            SExpression statement = statements.get(i);
            if (statement.isAtom()) {
                throw new CilParseException("Expected a statement, found '" + statement.getAtom() + "'",
                        statement.getLine());
            }
            nodes.add(buildStatement(statement));
        }
        return nodes;
    }

    /**
     * Build one statement, including its children for container flavors.
     */
    CilNode buildStatement(SExpression statement) throws CilParseException {
        if (statement.size() == 0 || !statement.get(0).isAtom()) {
            throw new CilParseException("Statement must start with a keyword", statement.getLine());
        }
        String keyword = statement.get(0).getAtom();
        CilFlavor flavor = CilFlavor.fromKeyword(keyword);
        if (flavor == null || flavor.isBranch()) {
            throw new CilParseException("Unknown statement '" + keyword + "'", statement.getLine());
        }
        int line = statement.getLine();
        try {
            return switch (flavor) {
                case BLOCK -> container(flavor, new NameStatement(name(statement, 1)), statement, 2);
                case OPTIONAL -> container(flavor, new NameStatement(name(statement, 1)), statement, 2);
                case MACRO -> container(flavor, macro(statement), statement, 3);
                case IN -> in(statement);
                case BOOLEANIF, TUNABLEIF -> conditional(flavor, statement);
                case CLASS, COMMON -> permissionContainer(flavor, CilFlavor.PERM, statement);
                case CLASSMAP -> permissionContainer(flavor, CilFlavor.MAP_PERM, statement);
                case TYPETRANSITION -> typeTransition(statement);
                default -> CilNode.leaf(flavor, data(flavor, statement), line);
            };
        } catch (PolicyModelException e) {
            throw new CilParseException(e.getMessage(), line);
        }
    }

    private CilData data(CilFlavor flavor, SExpression s) throws CilParseException {
        switch (flavor) {
            case ALLOW:
            case AUDITALLOW:
            case DONTAUDIT:
            case NEVERALLOW:
            case DENY:
                arity(s, 3);
                return new AccessVectorRule(name(s, 1), name(s, 2), classPermsRef(s.get(3)));
            case ALLOWX:
            case AUDITALLOWX:
            case DONTAUDITX:
            case NEVERALLOWX:
                arity(s, 3);
                return new ExtendedAccessVectorRule(name(s, 1), name(s, 2), permissionXRef(s.get(3)));
            case CALL:
                return call(s);
            case CLASSCOMMON:
            case ROLETYPE:
            case ROLEALLOW:
            case ROLEBOUNDS:
            case SENSITIVITYALIASACTUAL:
            case CATEGORYALIASACTUAL:
            case TYPEALIASACTUAL:
            case TYPEBOUNDS:
            case USERROLE:
            case USERBOUNDS:
            case USERPREFIX:
                arity(s, 2);
                return new Association(name(s, 1), name(s, 2));
            case CLASSORDER:
            case SIDORDER:
            case SENSITIVITYORDER:
            case CATEGORYORDER:
                arity(s, 1);
                return order(s.get(1));
            case CLASSPERMISSION:
            case BLOCKABSTRACT:
            case BLOCKINHERIT:
            case SENSITIVITY:
            case SENSITIVITYALIAS:
            case CATEGORY:
            case CATEGORYALIAS:
            case POLICYCAP:
            case ROLE:
            case ROLEATTRIBUTE:
            case SID:
            case TYPE:
            case TYPEALIAS:
            case TYPEATTRIBUTE:
            case TYPEPERMISSIVE:
            case USER:
            case USERATTRIBUTE:
                arity(s, 1);
                return new NameStatement(name(s, 1));
            case CLASSPERMISSIONSET:
                arity(s, 2);
                return new ClassPermissionSet(name(s, 1), classPerms(list(s, 2)));
            case CLASSMAPPING:
                arity(s, 3);
                return new ClassMapping(name(s, 1), name(s, 2), classPermsRef(s.get(3)));
            case PERMISSIONX:
                arity(s, 2);
                return permissionX(name(s, 1), list(s, 2));
            case BOOLEAN:
            case TUNABLE:
                arity(s, 2);
                return new BooleanDecl(name(s, 1), bool(s.get(2)));
            case CONSTRAIN:
            case MLSCONSTRAIN:
                arity(s, 2);
                return new Constraint(classPermsRef(s.get(1)), expr(list(s, 2)));
            case VALIDATETRANS:
            case MLSVALIDATETRANS:
                arity(s, 2);
                return new ValidateTrans(name(s, 1), expr(list(s, 2)));
            case CONTEXT:
                arity(s, 2);
                return context(name(s, 1), list(s, 2));
            case DEFAULTUSER:
            case DEFAULTROLE:
            case DEFAULTTYPE:
                arity(s, 2);
                return new DefaultObject(names(s.get(1)), name(s, 2), null);
            case DEFAULTRANGE:
                arity(s, 2, 3);
                return new DefaultObject(names(s.get(1)), name(s, 2), s.size() > 3 ? name(s, 3) : null);
            case FILECON:
                arity(s, 3);
                return new FileCon(name(s, 1), fileType(s.get(2)), optionalContextRef(s.get(3)));
            case FSUSE:
                arity(s, 3);
                return new FsUse(name(s, 1), name(s, 2), contextRef(s.get(3)));
            case GENFSCON:
                arity(s, 3, 4);
                if (s.size() == 5) {
                    return new GenFsCon(name(s, 1), name(s, 2), fileType(s.get(3)), contextRef(s.get(4)));
                }
                return new GenFsCon(name(s, 1), name(s, 2), null, contextRef(s.get(3)));
            case IBPKEYCON: {
                arity(s, 3);
                long[] range = numberRange(s.get(2));
                return new IbPkeyCon(name(s, 1), range[0], range[1], contextRef(s.get(3)));
            }
            case IBENDPORTCON:
                arity(s, 3);
                return new IbEndPortCon(name(s, 1), number(s.get(2)), contextRef(s.get(3)));
            case CATEGORYSET:
                arity(s, 2);
                return new CategorySet(name(s, 1), expr(list(s, 2)));
            case SENSITIVITYCATEGORY:
                arity(s, 2);
                return new SensitivityCategory(name(s, 1), exprOrName(s.get(2)));
            case LEVEL:
                arity(s, 2);
                return level(name(s, 1), list(s, 2));
            case LEVELRANGE:
                arity(s, 2);
                return levelRange(name(s, 1), list(s, 2));
            case RANGETRANSITION:
                arity(s, 4);
                return new RangeTransition(name(s, 1), name(s, 2), name(s, 3), levelRangeRef(s.get(4)));
            case IPADDR: {
                arity(s, 2);
                IpAddr address = new IpAddr(name(s, 1), name(s, 2));
                address.toBytes();
                return address;
            }
            case NETIFCON:
                arity(s, 3);
                return new NetIfCon(name(s, 1), contextRef(s.get(2)), contextRef(s.get(3)));
            case NODECON:
                arity(s, 3);
                return new NodeCon(ipAddrRef(s.get(1)), ipAddrRef(s.get(2)), contextRef(s.get(3)));
            case PORTCON: {
                arity(s, 3);
                long[] range = numberRange(s.get(2));
                return new PortCon(name(s, 1), range[0], range[1], contextRef(s.get(3)));
            }
            case MLS:
                arity(s, 1);
                return new PolicySetting(String.valueOf(bool(s.get(1))));
            case HANDLEUNKNOWN:
                arity(s, 1);
                return new PolicySetting(oneOf(s.get(1), Set.of("allow", "deny", "reject")));
            case ROLEATTRIBUTESET:
            case TYPEATTRIBUTESET:
            case USERATTRIBUTESET:
                arity(s, 2);
                return new AttributeSet(name(s, 1), exprOrName(s.get(2)));
            case ROLETRANSITION:
            case TYPECHANGE:
            case TYPEMEMBER:
                arity(s, 4);
                return new TransitionRule(name(s, 1), name(s, 2), name(s, 3), null, name(s, 4));
            case SIDCONTEXT:
                arity(s, 2);
                return new SidContext(name(s, 1), contextRef(s.get(2)));
            case EXPANDTYPEATTRIBUTE:
                arity(s, 2);
                return new ExpandTypeAttribute(names(s.get(1)), bool(s.get(2)));
            case USERLEVEL:
                arity(s, 2);
                return new UserLevel(name(s, 1), levelRef(s.get(2)));
            case USERRANGE:
                arity(s, 2);
                return new UserRange(name(s, 1), levelRangeRef(s.get(2)));
            case SELINUXUSER:
                arity(s, 3);
                return new SelinuxUser(name(s, 1), name(s, 2), levelRangeRef(s.get(3)));
            case SELINUXUSERDEFAULT:
                arity(s, 2);
                return new SelinuxUser(null, name(s, 1), levelRangeRef(s.get(2)));
            case IOMEMCON:
            case IOPORTCON: {
                arity(s, 2);
                long[] range = numberRange(s.get(1));
                return new DeviceCon(range[0], range[1], contextRef(s.get(2)));
            }
            case PCIDEVICECON:
            case PIRQCON: {
                arity(s, 2);
                long value = number(s.get(1));
                return new DeviceCon(value, value, contextRef(s.get(2)));
            }
            case DEVICETREECON:
                arity(s, 2);
                return new DeviceTreeCon(name(s, 1), contextRef(s.get(2)));
            default:
                throw new CilParseException("Statement '" + flavor.getDisplayName() + "' is not allowed here",
                        s.getLine());
        }
    }

    private CilNode container(CilFlavor flavor, CilData data, SExpression s, int bodyFrom) throws CilParseException {
        if (s.size() < bodyFrom) {
            throw new CilParseException(flavor.getDisplayName() + " is missing arguments", s.getLine());
        }
        return new CilNode(flavor, data, buildStatements(s.getItems(), bodyFrom), s.getLine());
    }

    private Macro macro(SExpression s) throws CilParseException {
        SExpression params = list(s, 2);
        List<Macro.Parameter> parameters = new ArrayList<>();
        for (SExpression param : params.getItems()) {
            if (param.isAtom() || param.size() != 2) {
                throw new CilParseException("Macro parameter must be (type name)", param.getLine());
            }
            parameters.add(new Macro.Parameter(name(param, 0), name(param, 1)));
        }
        return new Macro(name(s, 1), parameters);
    }

    private CilNode in(SExpression s) throws CilParseException {
        if (s.size() < 2) {
            throw new CilParseException("in is missing the block name", s.getLine());
        }
        String first = name(s, 1);
        if ((first.equals("before") || first.equals("after")) && s.size() >= 3 && s.get(2).isAtom()) {
            return container(CilFlavor.IN, new InStatement(first.equals("after"), name(s, 2)), s, 3);
        }
        return container(CilFlavor.IN, new InStatement(false, first), s, 2);
    }

    private CilNode conditional(CilFlavor flavor, SExpression s) throws CilParseException {
        if (s.size() < 2) {
            throw new CilParseException(flavor.getDisplayName() + " is missing its condition", s.getLine());
        }
        List<CilNode> branches = new ArrayList<>();
        for (int i = 2; i < s.size(); i++) {
            SExpression branch = s.get(i);
            if (branch.isAtom() || branch.size() == 0 || !branch.get(0).isAtom()) {
                throw new CilParseException("Expected a true or false branch", branch.getLine());
            }
            CilFlavor branchFlavor = switch (branch.get(0).getAtom()) {
                case "true" -> CilFlavor.CONDTRUE;
                case "false" -> CilFlavor.CONDFALSE;
                default -> throw new CilParseException("Expected a true or false branch, found '"
                        + branch.get(0).getAtom() + "'", branch.getLine());
            };
            branches.add(new CilNode(branchFlavor, new Branch(), buildStatements(branch.getItems(), 1),
                    branch.getLine()));
        }
        return new CilNode(flavor, new Conditional(exprOrName(s.get(1))), branches, s.getLine());
    }

    private CilNode permissionContainer(CilFlavor flavor, CilFlavor permFlavor, SExpression s) throws CilParseException {
        arity(s, 1, 2);
        List<CilNode> perms = new ArrayList<>();
        if (s.size() == 3) {
            for (SExpression perm : list(s, 2).getItems()) {
                if (perm.isList()) {
                    throw new CilParseException("Permission must be a name", perm.getLine());
                }
                perms.add(CilNode.leaf(permFlavor, new NameStatement(perm.getAtom()), perm.getLine()));
            }
        }
        return new CilNode(flavor, new NameStatement(name(s, 1)), perms, s.getLine());
    }

    private CilNode typeTransition(SExpression s) throws CilParseException {
        arity(s, 4, 5);
        if (s.size() == 6) {
            return CilNode.leaf(CilFlavor.NAMETYPETRANSITION,
                    new TransitionRule(name(s, 1), name(s, 2), name(s, 3), name(s, 4), name(s, 5)), s.getLine());
        }
        return CilNode.leaf(CilFlavor.TYPETRANSITION,
                new TransitionRule(name(s, 1), name(s, 2), name(s, 3), null, name(s, 4)), s.getLine());
    }

    private Call call(SExpression s) throws CilParseException {
        arity(s, 1, 2);
        List<Call.Argument> arguments = new ArrayList<>();
        if (s.size() == 3) {
            for (SExpression arg : list(s, 2).getItems()) {
                arguments.add(callArgument(arg));
            }
        }
        return new Call(name(s, 1), arguments);
    }

    private Call.Argument callArgument(SExpression arg) {
        if (arg.isAtom()) {
            return Call.Argument.string(arg.getAtom());
        }
        List<Call.Argument> children = new ArrayList<>();
        for (SExpression child : arg.getItems()) {
            children.add(callArgument(child));
        }
        return Call.Argument.list(children);
    }

    private OrderStatement order(SExpression list) throws CilParseException {
        List<String> names = names(list);
        if (!names.isEmpty() && names.get(0).equals("unordered")) {
            return new OrderStatement(true, names.subList(1, names.size()));
        }
        return new OrderStatement(false, names);
    }

    private Ref<ClassPerms> classPermsRef(SExpression s) throws CilParseException {
        if (s.isAtom()) {
            return Ref.named(s.getAtom());
        }
        return Ref.inline(classPerms(s));
    }

    private ClassPerms classPerms(SExpression s) throws CilParseException {
        if (s.isAtom() || s.size() != 2) {
            throw new CilParseException("Class permissions must be (class (permissions))", s.getLine());
        }
        return new ClassPerms(name(s, 0), exprOrName(s.get(1)));
    }

    private Ref<PermissionX> permissionXRef(SExpression s) throws CilParseException {
        if (s.isAtom()) {
            return Ref.named(s.getAtom());
        }
        return Ref.inline(permissionX(null, s));
    }

    private PermissionX permissionX(String name, SExpression s) throws CilParseException {
        if (s.isAtom() || s.size() != 3) {
            throw new CilParseException("Extended permissions must be (kind class expression)", s.getLine());
        }
        return new PermissionX(name, name(s, 0), name(s, 1), exprOrName(s.get(2)));
    }

    private Ref<Context> optionalContextRef(SExpression s) throws CilParseException {
        if (s.isList() && s.size() == 0) {
            return null;
        }
        return contextRef(s);
    }

    private Ref<Context> contextRef(SExpression s) throws CilParseException {
        if (s.isAtom()) {
            return Ref.named(s.getAtom());
        }
        return Ref.inline(context(null, s));
    }

    private Context context(String name, SExpression s) throws CilParseException {
        if (s.isAtom() || s.size() != 4) {
            throw new CilParseException("Context must be (user role type levelrange)", s.getLine());
        }
        return new Context(name, name(s, 0), name(s, 1), name(s, 2), levelRangeRef(s.get(3)));
    }

    private Ref<LevelRange> levelRangeRef(SExpression s) throws CilParseException {
        if (s.isAtom()) {
            return Ref.named(s.getAtom());
        }
        return Ref.inline(levelRange(null, s));
    }

    private LevelRange levelRange(String name, SExpression s) throws CilParseException {
        if (s.size() != 2) {
            throw new CilParseException("Level range must be (low high)", s.getLine());
        }
        return new LevelRange(name, levelRef(s.get(0)), levelRef(s.get(1)));
    }

    private Ref<Level> levelRef(SExpression s) throws CilParseException {
        if (s.isAtom()) {
            return Ref.named(s.getAtom());
        }
        return Ref.inline(level(null, s));
    }

    private Level level(String name, SExpression s) throws CilParseException {
        if (s.size() < 1 || s.size() > 2) {
            throw new CilParseException("Level must be (sensitivity [categories])", s.getLine());
        }
        CilExpr categories = s.size() == 2 ? exprOrName(s.get(1)) : null;
        return new Level(name, name(s, 0), categories);
    }

    private Ref<IpAddr> ipAddrRef(SExpression s) throws CilParseException {
        if (s.isAtom()) {
            return Ref.named(s.getAtom());
        }
        if (s.size() != 1) {
            throw new CilParseException("Inline IP address must be (address)", s.getLine());
        }
        IpAddr address = new IpAddr(null, name(s, 0));
        address.toBytes();
        return Ref.inline(address);
    }

    /**
     * An expression written as a list, or a single name standing for a one-operand list.
     */
    private CilExpr exprOrName(SExpression s) throws CilParseException {
        if (s.isAtom()) {
            return CilExpr.names(List.of(s.getAtom()));
        }
        return expr(s);
    }

    CilExpr expr(SExpression s) throws CilParseException {
        List<SExpression> items = s.getItems();
        ExprOperator operator = null;
        int from = 0;
        if (!items.isEmpty() && items.get(0).isAtom()) {
            operator = ExprOperator.fromKeyword(items.get(0).getAtom());
            if (operator != null) {
                from = 1;
            }
        }
        List<CilExpr.Operand> operands = new ArrayList<>();
        for (int i = from; i < items.size(); i++) {
            SExpression item = items.get(i);
            operands.add(item.isAtom() ? CilExpr.Operand.name(item.getAtom()) : CilExpr.Operand.expr(expr(item)));
        }
        return new CilExpr(operator, operands);
    }

    private List<String> names(SExpression s) throws CilParseException {
        if (s.isAtom()) {
            return List.of(s.getAtom());
        }
        List<String> names = new ArrayList<>();
        for (SExpression item : s.getItems()) {
            if (item.isList()) {
                throw new CilParseException("Expected a list of names", item.getLine());
            }
            names.add(item.getAtom());
        }
        return names;
    }

    private static String fileType(SExpression s) throws CilParseException {
        return oneOf(s, FILE_TYPES);
    }

    private static String oneOf(SExpression s, Set<String> allowed) throws CilParseException {
        if (s.isList() || !allowed.contains(s.getAtom())) {
            throw new CilParseException("Expected one of " + allowed.stream().sorted().toList()
                    + ", found " + s, s.getLine());
        }
        return s.getAtom();
    }

    private static boolean bool(SExpression s) throws CilParseException {
        return Boolean.parseBoolean(oneOf(s, Set.of("true", "false")));
    }

    private static long number(SExpression s) throws CilParseException {
        if (s.isList()) {
            throw new CilParseException("Expected a number, found " + s, s.getLine());
        }
        try {
            return Long.decode(s.getAtom());
        } catch (NumberFormatException e) {
            throw new CilParseException("Invalid number '" + s.getAtom() + "'", s.getLine());
        }
    }

    /**
     * A single number or a {@code (low high)} pair.
     */
    private static long[] numberRange(SExpression s) throws CilParseException {
        if (s.isAtom()) {
            long value = number(s);
            return new long[]{value, value};
        }
        if (s.size() != 2) {
            throw new CilParseException("Range must be (low high)", s.getLine());
        }
        return new long[]{number(s.get(0)), number(s.get(1))};
    }

    private static String name(SExpression s, int index) throws CilParseException {
        if (index >= s.size()) {
            throw new CilParseException("Missing argument " + index + " in " + s, s.getLine());
        }
        SExpression item = s.get(index);
        if (item.isList()) {
            throw new CilParseException("Expected a name, found " + item, item.getLine());
        }
        return item.getAtom();
    }

    private static SExpression list(SExpression s, int index) throws CilParseException {
        if (index >= s.size()) {
            throw new CilParseException("Missing argument " + index + " in " + s, s.getLine());
        }
        SExpression item = s.get(index);
        if (item.isAtom()) {
            throw new CilParseException("Expected a list, found '" + item.getAtom() + "'", item.getLine());
        }
        return item;
    }

    private static void arity(SExpression s, int count) throws CilParseException {
        arity(s, count, count);
    }

    private static void arity(SExpression s, int min, int max) throws CilParseException {
        int args = s.size() - 1;
        if (args < min || args > max) {
            String expected = min == max ? String.valueOf(min) : min + " to " + max;
            throw new CilParseException(s.get(0).getAtom() + " expects " + expected + " arguments, found " + args,
                    s.getLine());
        }
    }
}
