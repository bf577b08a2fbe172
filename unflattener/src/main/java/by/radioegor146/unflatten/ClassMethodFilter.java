package by.radioegor146.unflatten;

import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;

public class ClassMethodFilter {

    private final ClassMethodList blackList;
    private final ClassMethodList whiteList;

    /**
     * @param whiteList null when every class is allowed
     */
    public ClassMethodFilter(ClassMethodList blackList, ClassMethodList whiteList) {
        this.blackList = blackList;
        this.whiteList = whiteList;
    }

    public static ClassMethodFilter of(DeobfuscatorConfig config) {
        return new ClassMethodFilter(ClassMethodList.parse(config.getBlackList()),
                config.getWhiteList() == null ? null : ClassMethodList.parse(config.getWhiteList()));
    }

    private static boolean hasInList(ClassMethodList list, String name) {
        if (list == null) {
            return false;
        }
        return list.contains(name);
    }

    public boolean shouldProcess(ClassNode classNode) {
        if (hasInList(blackList, classNode.name)) {
            return false;
        }
        if (whiteList == null) {
            return true;
        }
        return classNode.methods.stream().anyMatch(methodNode -> shouldProcess(classNode, methodNode));
    }

    public boolean shouldProcess(ClassNode classNode, MethodNode methodNode) {
        String name = ClassMethodList.nameOf(classNode.name, methodNode.name, methodNode.desc);
        if (hasInList(blackList, name)) {
            return false;
        }
        return whiteList == null || hasInList(whiteList, name);
    }
}
