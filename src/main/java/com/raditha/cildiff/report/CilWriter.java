package com.raditha.cildiff.report;

import com.raditha.cildiff.model.AccessVectorRule;
import com.raditha.cildiff.model.Association;
import com.raditha.cildiff.model.AttributeSet;
import com.raditha.cildiff.model.BooleanDecl;
import com.raditha.cildiff.model.Branch;
import com.raditha.cildiff.model.Call;
import com.raditha.cildiff.model.CategorySet;
import com.raditha.cildiff.model.CilData;
import com.raditha.cildiff.model.CilDataVisitor;
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
import com.raditha.cildiff.model.PolicySetting;
import com.raditha.cildiff.model.PortCon;
import com.raditha.cildiff.model.RangeTransition;
import com.raditha.cildiff.model.Ref;
import com.raditha.cildiff.model.Root;
import com.raditha.cildiff.model.SelinuxUser;
import com.raditha.cildiff.model.SensitivityCategory;
import com.raditha.cildiff.model.SidContext;
import com.raditha.cildiff.model.TransitionRule;
import com.raditha.cildiff.model.UserLevel;
import com.raditha.cildiff.model.UserRange;
import com.raditha.cildiff.model.ValidateTrans;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Writes {@link CilNode} trees back as CIL source.
 * <p>
 * The output parses to a tree with the same content hashes as the input. Formatting,
 * comments and number radix of the original text are not preserved.
 */
public class CilWriter implements CilDataVisitor<String> {

    private static final String INDENT = "    ";
    private static final Pattern NEEDS_QUOTES = Pattern.compile("[\\s();\"]");

    /**
     * Write a node and its subtree. The root node writes its children only.
     */
    public String write(CilNode node) {
        StringBuilder out = new StringBuilder();
        write(node, 0, out);
        return out.toString();
    }

    /**
     * The statement line of a node without its children and without the enclosing parentheses.
     */
    public String header(CilNode node) {
        return node.getData().accept(this, node.getFlavor());
    }

    private void write(CilNode node, int depth, StringBuilder out) {
        CilFlavor flavor = node.getFlavor();
        if (flavor == CilFlavor.ROOT) {
            for (CilNode child : node.getChildren()) {
                write(child, depth, out);
            }
            return;
        }
        String indent = INDENT.repeat(depth);
        String header = header(node);
        if (flavor.getKeyword() == null) {
            out.append(indent).append(header).append('\n');
        } else if (flavor == CilFlavor.CLASS || flavor == CilFlavor.COMMON || flavor == CilFlavor.CLASSMAP) {
            List<String> perms = new ArrayList<>();
            for (CilNode perm : node.getChildren()) {
                perms.add(header(perm));
            }
            out.append(indent).append('(').append(header).append(" (").append(String.join(" ", perms)).append("))\n");
        } else if (!flavor.isContainer() || node.getChildren().isEmpty()) {
            out.append(indent).append('(').append(header).append(")\n");
        } else {
            out.append(indent).append('(').append(header).append('\n');
            for (CilNode child : node.getChildren()) {
                write(child, depth + 1, out);
            }
            out.append(indent).append(")\n");
        }
    }

    @Override
    public String visit(AccessVectorRule data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.source()), atom(data.target()), classPerms(data.classPerms()));
    }

    @Override
    public String visit(Association data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.subject()), atom(data.object()));
    }

    @Override
    public String visit(AttributeSet data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.attribute()), expr(data.expression()));
    }

    @Override
    public String visit(BooleanDecl data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.name()), String.valueOf(data.value()));
    }

    @Override
    public String visit(Branch data, CilFlavor flavor) {
        return flavor.getKeyword();
    }

    @Override
    public String visit(Call data, CilFlavor flavor) {
        if (data.arguments().isEmpty()) {
            return join(flavor.getKeyword(), atom(data.macro()));
        }
        return join(flavor.getKeyword(), atom(data.macro()), arguments(data.arguments()));
    }

    @Override
    public String visit(CategorySet data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.name()), expr(data.categories()));
    }

    @Override
    public String visit(ClassMapping data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.classMap()), atom(data.mapPerm()), classPerms(data.classPerms()));
    }

    @Override
    public String visit(ClassPermissionSet data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.name()), classPermsBody(data.classPerms()));
    }

    @Override
    public String visit(ClassPerms data, CilFlavor flavor) {
        return classPermsBody(data);
    }

    @Override
    public String visit(Conditional data, CilFlavor flavor) {
        return join(flavor.getKeyword(), expr(data.condition()));
    }

    @Override
    public String visit(Constraint data, CilFlavor flavor) {
        return join(flavor.getKeyword(), classPerms(data.classPerms()), expr(data.expression()));
    }

    @Override
    public String visit(Context data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.name()), contextBody(data));
    }

    @Override
    public String visit(DefaultObject data, CilFlavor flavor) {
        String classes = list(data.classes());
        if (data.range() == null) {
            return join(flavor.getKeyword(), classes, atom(data.object()));
        }
        return join(flavor.getKeyword(), classes, atom(data.object()), atom(data.range()));
    }

    @Override
    public String visit(DeviceCon data, CilFlavor flavor) {
        String value = flavor == CilFlavor.IOMEMCON || flavor == CilFlavor.IOPORTCON
                ? range(data.low(), data.high())
                : String.valueOf(data.low());
        return join(flavor.getKeyword(), value, context(data.context()));
    }

    @Override
    public String visit(DeviceTreeCon data, CilFlavor flavor) {
        return join(flavor.getKeyword(), quote(data.path()), context(data.context()));
    }

    @Override
    public String visit(ExpandTypeAttribute data, CilFlavor flavor) {
        return join(flavor.getKeyword(), list(data.attributes()), String.valueOf(data.expand()));
    }

    @Override
    public String visit(ExtendedAccessVectorRule data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.source()), atom(data.target()),
                ref(data.permissionX(), this::permissionX));
    }

    @Override
    public String visit(FileCon data, CilFlavor flavor) {
        String context = data.context() == null ? "()" : context(data.context());
        return join(flavor.getKeyword(), quote(data.path()), data.fileType(), context);
    }

    @Override
    public String visit(FsUse data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.type()), atom(data.fileSystem()), context(data.context()));
    }

    @Override
    public String visit(GenFsCon data, CilFlavor flavor) {
        if (data.fileType() == null) {
            return join(flavor.getKeyword(), atom(data.fileSystem()), quote(data.path()), context(data.context()));
        }
        return join(flavor.getKeyword(), atom(data.fileSystem()), quote(data.path()), data.fileType(),
                context(data.context()));
    }

    @Override
    public String visit(IbEndPortCon data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.device()), String.valueOf(data.port()), context(data.context()));
    }

    @Override
    public String visit(IbPkeyCon data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.subnetPrefix()), range(data.low(), data.high()),
                context(data.context()));
    }

    @Override
    public String visit(InStatement data, CilFlavor flavor) {
        return join(flavor.getKeyword(), data.after() ? "after" : "before", atom(data.block()));
    }

    @Override
    public String visit(IpAddr data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.name()), data.address());
    }

    @Override
    public String visit(Level data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.name()), level(data));
    }

    @Override
    public String visit(LevelRange data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.name()), levelRange(data));
    }

    @Override
    public String visit(Macro data, CilFlavor flavor) {
        List<String> params = new ArrayList<>();
        for (Macro.Parameter parameter : data.parameters()) {
            params.add("(" + atom(parameter.type()) + " " + atom(parameter.name()) + ")");
        }
        return join(flavor.getKeyword(), atom(data.name()), "(" + String.join(" ", params) + ")");
    }

    @Override
    public String visit(NameStatement data, CilFlavor flavor) {
        if (flavor.getKeyword() == null) {
            return atom(data.name());
        }
        return join(flavor.getKeyword(), atom(data.name()));
    }

    @Override
    public String visit(NetIfCon data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.interfaceName()), context(data.interfaceContext()),
                context(data.packetContext()));
    }

    @Override
    public String visit(NodeCon data, CilFlavor flavor) {
        return join(flavor.getKeyword(), ipAddr(data.address()), ipAddr(data.mask()), context(data.context()));
    }

    @Override
    public String visit(OrderStatement data, CilFlavor flavor) {
        List<String> items = new ArrayList<>();
        if (data.unordered()) {
            items.add("unordered");
        }
        items.addAll(data.order());
        return join(flavor.getKeyword(), list(items));
    }

    @Override
    public String visit(PermissionX data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.name()), permissionX(data));
    }

    @Override
    public String visit(PolicySetting data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.value()));
    }

    @Override
    public String visit(PortCon data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.protocol()), range(data.low(), data.high()),
                context(data.context()));
    }

    @Override
    public String visit(RangeTransition data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.source()), atom(data.executable()), atom(data.objectClass()),
                ref(data.range(), this::levelRange));
    }

    @Override
    public String visit(Root data, CilFlavor flavor) {
        return "";
    }

    @Override
    public String visit(SelinuxUser data, CilFlavor flavor) {
        String range = ref(data.range(), this::levelRange);
        if (data.name() == null) {
            return join(flavor.getKeyword(), atom(data.user()), range);
        }
        return join(flavor.getKeyword(), atom(data.name()), atom(data.user()), range);
    }

    @Override
    public String visit(SensitivityCategory data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.sensitivity()), expr(data.categories()));
    }

    @Override
    public String visit(SidContext data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.sid()), context(data.context()));
    }

    @Override
    public String visit(TransitionRule data, CilFlavor flavor) {
        if (data.objectName() == null) {
            return join(flavor.getKeyword(), atom(data.source()), atom(data.target()), atom(data.objectClass()),
                    atom(data.result()));
        }
        return join(flavor.getKeyword(), atom(data.source()), atom(data.target()), atom(data.objectClass()),
                quote(data.objectName()), atom(data.result()));
    }

    @Override
    public String visit(UserLevel data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.user()), ref(data.level(), this::level));
    }

    @Override
    public String visit(UserRange data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.user()), ref(data.range(), this::levelRange));
    }

    @Override
    public String visit(ValidateTrans data, CilFlavor flavor) {
        return join(flavor.getKeyword(), atom(data.className()), expr(data.expression()));
    }

    String expr(CilExpr expr) {
        List<String> items = new ArrayList<>();
        if (expr.operator() != null) {
            items.add(expr.operator().getKeyword());
        }
        for (CilExpr.Operand operand : expr.operands()) {
            items.add(operand.name() != null ? atom(operand.name()) : expr(operand.expr()));
        }
        return "(" + String.join(" ", items) + ")";
    }

    private String classPerms(Ref<ClassPerms> ref) {
        return ref(ref, this::classPermsBody);
    }

    private String classPermsBody(ClassPerms classPerms) {
        return "(" + atom(classPerms.className()) + " " + expr(classPerms.permissions()) + ")";
    }

    private String permissionX(PermissionX permissionX) {
        return "(" + join(atom(permissionX.kind()), atom(permissionX.className()), expr(permissionX.permissions())) + ")";
    }

    private String context(Ref<Context> ref) {
        return ref(ref, this::contextBody);
    }

    private String contextBody(Context context) {
        return "(" + join(atom(context.user()), atom(context.role()), atom(context.type()),
                ref(context.range(), this::levelRange)) + ")";
    }

    private String levelRange(LevelRange range) {
        return "(" + ref(range.low(), this::level) + " " + ref(range.high(), this::level) + ")";
    }

    private String level(Level level) {
        if (level.categories() == null) {
            return "(" + atom(level.sensitivity()) + ")";
        }
        return "(" + atom(level.sensitivity()) + " " + expr(level.categories()) + ")";
    }

    private String ipAddr(Ref<IpAddr> ref) {
        return ref(ref, address -> "(" + address.address() + ")");
    }

    private String arguments(List<Call.Argument> arguments) {
        List<String> items = new ArrayList<>();
        for (Call.Argument argument : arguments) {
            items.add(argument.isList() ? arguments(argument.children()) : atom(argument.value()));
        }
        return "(" + String.join(" ", items) + ")";
    }

    private static <T extends CilData> String ref(Ref<T> ref, Function<T, String> inline) {
        return ref.isNamed() ? atom(ref.name()) : inline.apply(ref.inline());
    }

    private static String list(List<String> names) {
        List<String> atoms = new ArrayList<>();
        for (String name : names) {
            atoms.add(atom(name));
        }
        return "(" + String.join(" ", atoms) + ")";
    }

    private static String range(long low, long high) {
        return low == high ? String.valueOf(low) : "(" + low + " " + high + ")";
    }

    static String atom(String value) {
        if (value.isEmpty() || NEEDS_QUOTES.matcher(value).find()) {
            return quote(value);
        }
        return value;
    }

    private static String quote(String value) {
        return "\"" + value + "\"";
    }

    private static String join(String... parts) {
        return String.join(" ", parts);
    }
}
